package io.deskrelay.handler;

public final class EchoHandler implements Handler {
    public static final String TYPE = "echo";
    public static final PayloadShape SHAPE = PayloadShape.builder()
            .required("msg", ParamKind.STRING)
            .build();

    @Override
    public HandlerResult execute(HandlerContext context) {
        return HandlerResult.ok(context.string("msg"));
    }
}
