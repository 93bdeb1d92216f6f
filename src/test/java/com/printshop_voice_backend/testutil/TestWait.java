package com.printshop_voice_backend.testutil;

import java.util.function.BooleanSupplier;

public final class TestWait {

    private TestWait() {
    }

    public static void until(BooleanSupplier condition, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Condition not met within " + timeoutMs + " ms");
            }
            Thread.sleep(10);
        }
    }
}
