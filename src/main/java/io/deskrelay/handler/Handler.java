package io.deskrelay.handler;

public interface Handler {
    HandlerResult execute(HandlerContext context) throws Exception;
}
