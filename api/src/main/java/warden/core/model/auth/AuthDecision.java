package warden.core.model.auth;

import java.util.Objects;
import java.util.function.Function;

import warden.core.model.error.AuthError;

/**
 * Outcome of one authentication step: the accepted value or the first error.
 *
 * @param <T> type of the accepted value
 */
public sealed interface AuthDecision<T> {

    /**
     * The step succeeded.
     *
     * @param value the accepted value
     */
    record Accepted<T>(T value) implements AuthDecision<T> {
        public Accepted {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * The step failed.
     *
     * @param error the classified failure
     */
    record Rejected<T>(AuthError error) implements AuthDecision<T> {
        public Rejected {
            Objects.requireNonNull(error, "error");
        }
    }

    static <T> AuthDecision<T> accepted(T value) {
        return new Accepted<>(value);
    }

    static <T> AuthDecision<T> rejected(AuthError error) {
        return new Rejected<>(error);
    }

    default boolean isAccepted() {
        return this instanceof Accepted;
    }

    /**
     * Transform the accepted value, passing a rejection through unchanged.
     */
    default <R> AuthDecision<R> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Accepted<T> accepted) {
            return new Accepted<>(mapper.apply(accepted.value()));
        }
        return new Rejected<>(((Rejected<T>) this).error());
    }

    /**
     * Continue with a further step when accepted. The first rejection wins.
     */
    default <R> AuthDecision<R> flatMap(Function<? super T, AuthDecision<R>> next) {
        if (this instanceof Accepted<T> accepted) {
            return next.apply(accepted.value());
        }
        return new Rejected<>(((Rejected<T>) this).error());
    }
}
