package io.signalbot.utils;

public enum LockType {
    POSITION
}
