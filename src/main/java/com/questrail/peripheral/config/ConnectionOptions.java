package com.questrail.peripheral.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Options passed through to the radio layer with a connect command.
 *
 * @param notifyOnConnection         platform alert when connecting in the background
 * @param notifyOnDisconnection      platform alert when disconnecting in the background
 * @param notifyOnNotification       platform alert for notifications while suspended
 * @param bridgeToClassic            bridge classic profiles over an existing low-energy link
 * @param requireNotificationCenter  require the notification-center service on connect
 * @param startDelay                 delay before the radio starts connecting
 */
public record ConnectionOptions(
    boolean notifyOnConnection,
    boolean notifyOnDisconnection,
    boolean notifyOnNotification,
    boolean bridgeToClassic,
    boolean requireNotificationCenter,
    Duration startDelay
) {
    public ConnectionOptions {
        Objects.requireNonNull(startDelay, "startDelay");
        if (startDelay.isNegative()) {
            throw new IllegalArgumentException("startDelay must not be negative");
        }
    }

    public static ConnectionOptions defaults() {
        return new ConnectionOptions(false, false, false, false, false, Duration.ZERO);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean notifyOnConnection;
        private boolean notifyOnDisconnection;
        private boolean notifyOnNotification;
        private boolean bridgeToClassic;
        private boolean requireNotificationCenter;
        private Duration startDelay = Duration.ZERO;

        public Builder withNotifyOnConnection(boolean notify) {
            this.notifyOnConnection = notify;
            return this;
        }

        public Builder withNotifyOnDisconnection(boolean notify) {
            this.notifyOnDisconnection = notify;
            return this;
        }

        public Builder withNotifyOnNotification(boolean notify) {
            this.notifyOnNotification = notify;
            return this;
        }

        public Builder withBridgeToClassic(boolean bridge) {
            this.bridgeToClassic = bridge;
            return this;
        }

        public Builder withRequireNotificationCenter(boolean require) {
            this.requireNotificationCenter = require;
            return this;
        }

        public Builder withStartDelay(Duration startDelay) {
            this.startDelay = startDelay;
            return this;
        }

        public ConnectionOptions build() {
            return new ConnectionOptions(notifyOnConnection, notifyOnDisconnection, notifyOnNotification,
                    bridgeToClassic, requireNotificationCenter, startDelay);
        }
    }
}
