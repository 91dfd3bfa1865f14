// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.examples;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.retrying.RetryConfig;
import software.amazon.retrying.proxy.RetryProxy;
import software.amazon.retrying.proxy.Retryable;
import software.amazon.retrying.wait.WaitType;

/** Example of declaring retries with {@link Retryable} on a client interface. */
public class InventoryProxyExample {

    private static final Logger logger = LoggerFactory.getLogger(InventoryProxyExample.class);

    public interface InventoryClient {
        @Retryable(
                stopAfterAttempt = 4,
                waitType = WaitType.EXPONENTIAL,
                waitMultiplierMillis = 50,
                waitMaxMillis = 1000,
                retryOn = IOException.class)
        int stockLevel(String sku) throws IOException;

        @Retryable(stopAfterAttempt = 2, wrapException = true)
        void reserve(String sku, int quantity) throws IOException;

        /** Not annotated: called once. */
        String region();
    }

    /** Backend that drops the first calls for each SKU. */
    public static class UnreliableInventory implements InventoryClient {
        private final int dropsPerSku;
        private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

        public UnreliableInventory(int dropsPerSku) {
            this.dropsPerSku = dropsPerSku;
        }

        @Override
        public int stockLevel(String sku) throws IOException {
            if (calls.computeIfAbsent(sku, key -> new AtomicInteger()).incrementAndGet() <= dropsPerSku) {
                throw new IOException("Connection reset while reading " + sku);
            }
            return sku.length() * 10;
        }

        @Override
        public void reserve(String sku, int quantity) throws IOException {
            if (quantity <= 0) {
                throw new IllegalArgumentException("quantity must be positive, got: " + quantity);
            }
            stockLevel(sku);
        }

        @Override
        public String region() {
            return "eu-west-1";
        }

        public int callsFor(String sku) {
            var count = calls.get(sku);
            return count == null ? 0 : count.get();
        }
    }

    public static InventoryClient retrying(InventoryClient target, RetryConfig baseConfig) {
        return RetryProxy.create(InventoryClient.class, target, baseConfig);
    }

    public static void main(String[] args) throws IOException {
        var client = retrying(new UnreliableInventory(2), RetryConfig.defaultConfig());
        logger.info("Stock level in {}: {}", client.region(), client.stockLevel("SKU-123"));
    }
}
