package io.deskrelay.handler;

public final class FailHandler implements Handler {
    public static final String TYPE = "fail";
    public static final PayloadShape SHAPE = PayloadShape.builder()
            .optional("reason", ParamKind.STRING)
            .build();

    @Override
    public HandlerResult execute(HandlerContext context) {
        String reason = context.string("reason");
        return HandlerResult.fail(reason == null || reason.isBlank() ? "intentional failure from fail handler" : reason);
    }
}
