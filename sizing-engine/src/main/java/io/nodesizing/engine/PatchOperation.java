/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.engine;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Single JSON Patch (RFC 6902) operation
 *
 * @param op        Operation (replace or add)
 * @param path      JSON pointer to the patched value
 * @param value     The new value
 */
@JsonPropertyOrder({"op", "path", "value"})
public record PatchOperation(String op, String path, String value) {
    public static final String REPLACE = "replace";
    public static final String ADD = "add";

    /**
     * @param path      JSON pointer
     * @param value     The new value
     *
     * @return  Replace operation
     */
    public static PatchOperation replace(String path, String value) {
        return new PatchOperation(REPLACE, path, value);
    }

    /**
     * @param path      JSON pointer
     * @param value     The new value
     *
     * @return  Add operation
     */
    public static PatchOperation add(String path, String value) {
        return new PatchOperation(ADD, path, value);
    }
}
