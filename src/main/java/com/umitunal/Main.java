package com.umitunal;

import com.umitunal.examples.*;

/**
 * Main class that runs all tasklite examples.
 */
public class Main {
    public static void main(String[] args) throws Exception {
        System.out.println("=== tasklite Examples ===\n");

        // Run all examples
        BasicExample.main(args);
        RetryExample.main(args);
        RecoveryExample.main(args);
        StorageQuotaExample.main(args);

        System.out.println("\n=== All Examples Complete ===");
    }
}
