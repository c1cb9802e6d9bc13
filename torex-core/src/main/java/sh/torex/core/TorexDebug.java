// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.core;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Trace channels of the exchange and which of them are switched on.
 * <p>
 * Channels start from the {@value #PROPERTY} system property, a comma-separated list of channel
 * names or {@code all}, e.g. {@code -Dtorex.debug=flow,controller}. They can be switched at
 * runtime; the active set is swapped as a whole, so readers never see a half-updated set.
 */
public final class TorexDebug {

    /** System property read once at class initialization. */
    public static final String PROPERTY = "torex.debug";

    /**
     * Trace channels.
     */
    public enum Channel {
        /** Trader flow updates and their back-adjustments. */
        FLOW,
        /** Benchmark quotes and liquidity movements. */
        MOVE,
        /** Contained controller hook failures. */
        CONTROLLER
    }

    private static volatile Set<Channel> active = parse(System.getProperty(PROPERTY));

    private TorexDebug() {
    }

    public static boolean isEnabled(final Channel channel) {
        return active.contains(channel);
    }

    /**
     * @return whether any channel is on
     */
    public static boolean isEnabled() {
        return !active.isEmpty();
    }

    /**
     * Switches every channel on or off.
     */
    public static void setEnabled(final boolean enabled) {
        active = enabled ? Collections.unmodifiableSet(EnumSet.allOf(Channel.class)) : Collections.emptySet();
    }

    public static synchronized void enable(final Channel... channels) {
        final EnumSet<Channel> next = copy(active);
        next.addAll(Arrays.asList(channels));
        active = Collections.unmodifiableSet(next);
    }

    public static synchronized void disable(final Channel... channels) {
        final EnumSet<Channel> next = copy(active);
        next.removeAll(Arrays.asList(channels));
        active = Collections.unmodifiableSet(next);
    }

    /**
     * Parses a channel list such as {@code "flow, move"}. Blank or {@code null} means none.
     *
     * @throws IllegalArgumentException on an unknown channel name
     */
    static Set<Channel> parse(final String value) {
        if (value == null || value.isBlank()) {
            return Collections.emptySet();
        }
        final EnumSet<Channel> channels = EnumSet.noneOf(Channel.class);
        for (String name : value.split(",")) {
            final String trimmed = name.trim().toUpperCase(Locale.ROOT);
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.equals("ALL")) {
                return Collections.unmodifiableSet(EnumSet.allOf(Channel.class));
            }
            try {
                channels.add(Channel.valueOf(trimmed));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("unknown " + PROPERTY + " channel: " + name.trim(), e);
            }
        }
        return Collections.unmodifiableSet(channels);
    }

    private static EnumSet<Channel> copy(final Set<Channel> channels) {
        return channels.isEmpty() ? EnumSet.noneOf(Channel.class) : EnumSet.copyOf(channels);
    }
}
