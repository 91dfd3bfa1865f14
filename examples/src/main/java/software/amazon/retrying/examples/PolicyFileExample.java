// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.examples;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.retrying.RetryConfig;
import software.amazon.retrying.Retryer;
import software.amazon.retrying.config.RetryPolicies;
import software.amazon.retrying.exception.SerDesException;

/** Example of keeping retry settings in a JSON policy shipped on the classpath. */
public class PolicyFileExample {

    private static final Logger logger = LoggerFactory.getLogger(PolicyFileExample.class);

    static final String POLICY_RESOURCE = "/retry-policy.json";

    /** Inline policy for the readiness check: poll every 50 ms until the service answers. */
    static final String HEALTH_CHECK_POLICY =
            "{\"name\": \"health-check\", \"stop\": {\"never\": true},"
                    + " \"wait\": {\"type\": \"FIXED\", \"fixed\": \"PT0.05S\"}}";

    public static RetryConfig.Builder loadPolicy() {
        try (InputStream in = PolicyFileExample.class.getResourceAsStream(POLICY_RESOURCE)) {
            if (in == null) {
                throw new SerDesException("Missing retry policy resource " + POLICY_RESOURCE);
            }
            var policy = RetryPolicies.fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            logger.info("Loaded retry policy '{}'", policy.name());
            return policy.toRetryConfig();
        } catch (IOException e) {
            throw new SerDesException("Failed to read retry policy resource " + POLICY_RESOURCE, e);
        }
    }

    public static RetryConfig healthCheckConfig() {
        return RetryPolicies.toRetryConfig(HEALTH_CHECK_POLICY);
    }

    public static void main(String[] args) {
        var checks = new int[1];
        Retryer.create(healthCheckConfig()).run(() -> {
            if (++checks[0] < 2) {
                throw new IOException("greeting service not ready");
            }
        });
        logger.info("Greeting service ready after {} health check(s)", checks[0]);

        var retryer = Retryer.create(loadPolicy().build());
        var attempts = new int[1];
        var greeting = retryer.execute(() -> {
            if (++attempts[0] < 3) {
                throw new IOException("greeting service unavailable");
            }
            return "hello after " + attempts[0] + " attempts";
        });
        logger.info(greeting);
    }
}
