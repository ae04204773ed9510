package io.signalbot.utils.lock.single_lock;

import io.signalbot.utils.LockType;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Runs the annotated method while holding the lock of {@link #registry()} for the value of parameter {@link #keyParam()}.
 * Only applies to calls made through the Spring proxy.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface WithLock {
    LockType registry();

    String keyParam();
}
