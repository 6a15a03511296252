/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.common;

import java.util.Map;
import java.util.TreeMap;

/**
 * Class with various utility methods shared between modules
 */
public class Util {
    private static final SizingLogger LOGGER = SizingLogger.create(Util.class);

    /**
     * Logs the environment variables of the webhook process, masking the ones which look like passwords.
     */
    public static void printEnvInfo() {
        Map<String, String> env = new TreeMap<>(System.getenv());
        StringBuilder sb = new StringBuilder();

        for (Map.Entry<String, String> entry: env.entrySet()) {
            sb.append("\t").append(entry.getKey()).append(": ").append(maskPassword(entry.getKey(), entry.getValue())).append("\n");
        }

        LOGGER.infoOp("Using config:\n" + sb);
    }

    /**
     * Gets environment variable, checks if it contains a password and in case it does it mask the output. It expects
     * environment variables with passwords to contain `PASSWORD` in their name.
     *
     * @param key   Name of the environment variable
     * @param value Value of the environment variable
     * @return      Value of the environment variable or masked text in case of password
     */
    /* test */ static String maskPassword(String key, String value)  {
        if (key.contains("PASSWORD"))  {
            return "********";
        } else {
            return value;
        }
    }

    /**
     * Escapes a string so that it can be used as a single reference token of a JSON pointer (RFC 6901).
     *
     * @param token     Reference token such as an annotation key
     *
     * @return  Escaped reference token
     */
    public static String escapeJsonPointerToken(String token) {
        return token.replace("~", "~0").replace("/", "~1");
    }
}
