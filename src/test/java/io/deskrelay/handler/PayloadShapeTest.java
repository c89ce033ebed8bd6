package io.deskrelay.handler;

import io.deskrelay.error.ValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class PayloadShapeTest {
    private final PayloadShape shape = PayloadShape.builder()
            .required("path", ParamKind.STRING)
            .optional("count", ParamKind.NUMBER)
            .optional("flags", ParamKind.ARRAY)
            .optional("options", ParamKind.OBJECT)
            .build();

    @Test
    void acceptsRequiredWithOrWithoutOptionals() {
        shape.validate(Map.of("path", "/tmp/a"));
        shape.validate(Map.of(
                "path", "/tmp/a",
                "count", 2.5,
                "flags", List.of("x"),
                "options", Map.of("deep", true)
        ));
    }

    @Test
    void reportsTheOffendingField() {
        ValidationException missing = Assertions.assertThrows(ValidationException.class,
                () -> shape.validate(Map.of("count", 1)));
        Assertions.assertEquals("payload.path", missing.field());

        ValidationException wrongKind = Assertions.assertThrows(ValidationException.class,
                () -> shape.validate(Map.of("path", "/tmp/a", "count", "three")));
        Assertions.assertEquals("payload.count", wrongKind.field());
        Assertions.assertTrue(wrongKind.getMessage().contains("number"), wrongKind.getMessage());

        ValidationException undeclared = Assertions.assertThrows(ValidationException.class,
                () -> shape.validate(Map.of("path", "/tmp/a", "force", true)));
        Assertions.assertEquals("payload.force", undeclared.field());
    }

    @Test
    void emptyShapeAcceptsOnlyEmptyPayloads() {
        PayloadShape.empty().validate(null);
        PayloadShape.empty().validate(Map.of());
        Assertions.assertThrows(ValidationException.class, () -> PayloadShape.empty().validate(Map.of("x", 1)));
    }
}
