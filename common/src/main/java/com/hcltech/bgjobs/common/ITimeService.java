package com.hcltech.bgjobs.common;

public interface ITimeService {
    long currentTimeNanos();

    ITimeService real = System::nanoTime;

    static ITimeService fixed(long fixedTimeNanos) {
        return () -> fixedTimeNanos;
    }
}
