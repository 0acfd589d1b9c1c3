package com.distributed26.adaptivestream.streaming;

import com.distributed26.adaptivestream.shared.errors.ValidationException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * What the player tells us about itself: an optional bandwidth estimate, whether it runs on a phone or
 * tablet, and whether its connection is reported as slow or cellular.
 */
public final class ClientHint {
    private static final Pattern MOBILE_AGENT = Pattern.compile("mobile|android|iphone|ipad", Pattern.CASE_INSENSITIVE);
    private static final Pattern SLOW_CONNECTION = Pattern.compile("\\b(slow|cellular|2g|3g)\\b", Pattern.CASE_INSENSITIVE);
    private static final ClientHint NONE = new ClientHint(null, false, false);

    private final Integer bandwidthKbps;
    private final boolean mobile;
    private final boolean slowConnection;

    private ClientHint(Integer bandwidthKbps, boolean mobile, boolean slowConnection) {
        this.bandwidthKbps = bandwidthKbps;
        this.mobile = mobile;
        this.slowConnection = slowConnection;
    }

    public static ClientHint none() {
        return NONE;
    }

    public static ClientHint of(Integer bandwidthKbps, String userAgent) {
        return of(bandwidthKbps, userAgent, null);
    }

    public static ClientHint of(Integer bandwidthKbps, String userAgent, String connection) {
        if (bandwidthKbps != null && bandwidthKbps <= 0) {
            throw new ValidationException("bandwidth must be a positive number of kbps, got " + bandwidthKbps);
        }
        return new ClientHint(bandwidthKbps, isMobileAgent(userAgent), isSlowConnection(connection));
    }

    public static ClientHint fromRequest(String bandwidthParam, String userAgent) {
        return fromRequest(bandwidthParam, userAgent, null);
    }

    /**
     * Builds a hint from the raw {@code bandwidth} query parameter, the {@code User-Agent} header and a
     * connection type such as {@code cellular} or {@code slow-2g}.
     *
     * @throws ValidationException if {@code bandwidth} is present but not a positive integer
     */
    public static ClientHint fromRequest(String bandwidthParam, String userAgent, String connection) {
        Integer kbps = null;
        if (bandwidthParam != null && !bandwidthParam.isBlank()) {
            try {
                kbps = Integer.parseInt(bandwidthParam.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("bandwidth must be an integer number of kbps, got '" + bandwidthParam + "'");
            }
        }
        return of(kbps, userAgent, connection);
    }

    static boolean isMobileAgent(String userAgent) {
        return userAgent != null && MOBILE_AGENT.matcher(userAgent).find();
    }

    /** {@code keep-alive} and {@code close} say nothing about speed and never match. */
    static boolean isSlowConnection(String connection) {
        return connection != null && SLOW_CONNECTION.matcher(connection).find();
    }

    public Optional<Integer> getBandwidthKbps() {
        return Optional.ofNullable(bandwidthKbps);
    }

    public boolean isMobile() {
        return mobile;
    }

    public boolean isSlowConnection() {
        return slowConnection;
    }

    /** Mobile players and slow links start no higher than SD. */
    public boolean prefersLowResolution() {
        return mobile || slowConnection;
    }

    @Override
    public String toString() {
        return "ClientHint{bandwidthKbps=" + bandwidthKbps + ", mobile=" + mobile
                + ", slowConnection=" + slowConnection + "}";
    }
}
