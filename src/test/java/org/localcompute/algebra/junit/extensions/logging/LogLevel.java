package org.localcompute.algebra.junit.extensions.logging;

public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
