package com.hcltech.bgjobs.common.errorsor;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ErrorsOrTest {

    @Nested
    class ConstructionAndPredicates {
        @Test
        void liftCreatesValue() {
            ErrorsOr<Integer> eo = ErrorsOr.lift(42);
            assertTrue(eo.isValue());
            assertFalse(eo.isError());
            assertEquals(Optional.of(42), eo.getValue());
            assertTrue(eo.getErrors().isEmpty());
        }

        @Test
        void liftRejectsNull() {
            assertThrows(NullPointerException.class, () -> ErrorsOr.lift(null));
        }

        @Test
        void errorsFactoryRejectsEmptyList() {
            assertThrows(IllegalArgumentException.class, () -> ErrorsOr.errors(List.of()));
        }

        @Test
        void errorFromExceptionUsesPattern() {
            ErrorsOr<String> eo = ErrorsOr.error("failed: {0}: {1}", new IOException("disk"));
            assertEquals(List.of("failed: IOException: disk"), eo.getErrors());
        }
    }

    @Nested
    class Combinators {
        @Test
        void mapAndFlatMapSkipErrors() {
            ErrorsOr<Integer> err = ErrorsOr.error("nope");
            assertEquals(List.of("nope"), err.map(i -> i + 1).getErrors());
            assertEquals(List.of("nope"), err.flatMap(i -> ErrorsOr.lift(i + 1)).getErrors());
            assertEquals(ErrorsOr.lift(3), ErrorsOr.lift(2).map(i -> i + 1));
            assertEquals(List.of("x"), ErrorsOr.lift(2).flatMap(i -> ErrorsOr.error("x")).getErrors());
        }

        @Test
        void addPrefixOnlyTouchesErrors() {
            assertEquals(List.of("cfg: a", "cfg: b"), ErrorsOr.errors(List.of("a", "b")).addPrefixIfError("cfg: ").getErrors());
            assertEquals(ErrorsOr.lift("v"), ErrorsOr.lift("v").addPrefixIfError("cfg: "));
        }

        @Test
        void foldPicksTheRightBranch() {
            assertEquals("v!", ErrorsOr.lift("v").fold(v -> v + "!", errs -> "bad"));
            assertEquals("bad1", ErrorsOr.<String>error("e").fold(v -> v, errs -> "bad" + errs.size()));
        }

        @Test
        void ifValueAndIfErrorAreExclusive() {
            List<Object> seen = new ArrayList<>();
            ErrorsOr.lift(1).ifValue(seen::add);
            ErrorsOr.lift(1).ifError(seen::add);
            ErrorsOr.error("e").ifError(seen::addAll);
            ErrorsOr.error("e").ifValue(seen::add);
            assertEquals(List.of(1, "e"), seen);
        }

        @Test
        void valueOrThrowReportsErrors() {
            IllegalStateException ex = assertThrows(IllegalStateException.class, () -> ErrorsOr.error("nope").valueOrThrow());
            assertTrue(ex.getMessage().contains("nope"));
            assertEquals("fallback", ErrorsOr.<String>error("nope").valueOrDefault("fallback"));
        }
    }

    @Nested
    class Trying {
        @Test
        void capturesCheckedExceptions() {
            ErrorsOr<String> eo = ErrorsOr.trying(() -> {
                throw new IOException("gone");
            });
            assertEquals(List.of("Evaluation error: IOException: gone"), eo.getErrors());
        }

        @Test
        void liftsSuccess() {
            assertEquals(ErrorsOr.lift("ok"), ErrorsOr.trying(() -> "ok"));
        }
    }
}
