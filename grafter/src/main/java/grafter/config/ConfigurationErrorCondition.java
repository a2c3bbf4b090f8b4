// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.config;

import grafter.error.ErrorKind;
import grafter.error.GrafterErrorCondition;

/**
 * A condition type indicating that a configuration is ambiguous or malformed. No parse is attempted with it.
 */
public final class ConfigurationErrorCondition extends GrafterErrorCondition {
    /**
     * Initializes a new configuration error with the given user-readable message.
     */
    public ConfigurationErrorCondition(final String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONFIGURATION;
    }

    @Override
    public String detailedMessage() {
        return "Invalid configuration: " + message();
    }
}
