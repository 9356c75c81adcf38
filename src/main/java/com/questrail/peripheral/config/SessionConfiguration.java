package com.questrail.peripheral.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Options used when opening a radio session.
 *
 * @param showPowerAlert    ask the platform to prompt the user if the radio is
 *                          powered off when the session opens
 * @param restoreIdentifier key under which the radio layer keeps the identifiers
 *                          it retains between process runs, if any
 */
public record SessionConfiguration(
    boolean showPowerAlert,
    Optional<String> restoreIdentifier
) {
    public SessionConfiguration {
        Objects.requireNonNull(restoreIdentifier, "restoreIdentifier");
        restoreIdentifier.ifPresent(id -> {
            if (id.isBlank()) {
                throw new IllegalArgumentException("restoreIdentifier must not be blank");
            }
        });
    }

    public static SessionConfiguration standard() {
        return new SessionConfiguration(false, Optional.empty());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean showPowerAlert;
        private String restoreIdentifier;

        public Builder withShowPowerAlert(boolean showPowerAlert) {
            this.showPowerAlert = showPowerAlert;
            return this;
        }

        public Builder withRestoreIdentifier(String restoreIdentifier) {
            this.restoreIdentifier = restoreIdentifier;
            return this;
        }

        public SessionConfiguration build() {
            return new SessionConfiguration(showPowerAlert, Optional.ofNullable(restoreIdentifier));
        }
    }
}
