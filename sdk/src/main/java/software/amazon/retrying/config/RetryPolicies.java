// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import software.amazon.retrying.RetryConfig;
import software.amazon.retrying.exception.SerDesException;
import software.amazon.retrying.serde.JacksonSerDes;
import software.amazon.retrying.serde.SerDes;
import software.amazon.retrying.validation.ParameterValidator;

/** Reads and writes {@link RetryPolicy} documents. */
public final class RetryPolicies {
    private static final SerDes SERDES = new JacksonSerDes();

    private RetryPolicies() {}

    /**
     * Parses a policy document.
     *
     * @param json the JSON document
     * @return the policy
     * @throws SerDesException if the document is malformed or has unknown properties
     */
    public static RetryPolicy fromJson(String json) {
        ParameterValidator.validateNotNull(json, "json");
        return SERDES.deserialize(json, RetryPolicy.class);
    }

    /**
     * Reads a policy document from a UTF-8 file.
     *
     * @param path the file to read
     * @return the policy
     * @throws SerDesException if the file cannot be read or parsed
     */
    public static RetryPolicy load(Path path) {
        ParameterValidator.validateNotNull(path, "path");
        try {
            return fromJson(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new SerDesException("Failed to read retry policy from " + path, e);
        }
    }

    /**
     * Reads a policy document and converts it to a configuration in one step.
     *
     * @param json the JSON document
     * @return the built configuration
     */
    public static RetryConfig toRetryConfig(String json) {
        return fromJson(json).toRetryConfig().build();
    }

    public static String toJson(RetryPolicy policy) {
        return SERDES.serialize(ParameterValidator.validateNotNull(policy, "policy"));
    }
}
