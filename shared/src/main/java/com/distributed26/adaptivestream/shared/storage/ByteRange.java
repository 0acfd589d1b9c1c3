package com.distributed26.adaptivestream.shared.storage;

import com.distributed26.adaptivestream.shared.errors.RangeNotSatisfiableException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single resolved HTTP byte range, inclusive on both ends.
 *
 * <p>Only single ranges are understood. Anything that does not parse is treated as absent so
 * the caller serves the whole resource; a well-formed range that lies outside the resource
 * raises {@link RangeNotSatisfiableException}.
 */
public final class ByteRange {
    private static final Pattern RANGE = Pattern.compile("^bytes=(\\d*)-(\\d*)$");

    private final long start;
    private final long end;
    private final long totalLength;

    ByteRange(long start, long end, long totalLength) {
        this.start = start;
        this.end = end;
        this.totalLength = totalLength;
    }

    public static Optional<ByteRange> parse(String header, long totalLength) {
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }
        Matcher m = RANGE.matcher(header.trim().replace(" ", ""));
        if (!m.matches()) {
            return Optional.empty();
        }
        String first = m.group(1);
        String last = m.group(2);
        if (first.isEmpty() && last.isEmpty()) {
            return Optional.empty();
        }
        long a;
        long b;
        try {
            if (first.isEmpty()) {
                long suffix = Long.parseLong(last);
                if (suffix == 0 || totalLength == 0) {
                    throw new RangeNotSatisfiableException("Empty suffix range: " + header, totalLength);
                }
                a = Math.max(0, totalLength - suffix);
                b = totalLength - 1;
            } else {
                a = Long.parseLong(first);
                b = last.isEmpty() ? totalLength - 1 : Long.parseLong(last);
                if (b < a) {
                    return Optional.empty();
                }
                if (a >= totalLength) {
                    throw new RangeNotSatisfiableException(
                            "Range start " + a + " beyond length " + totalLength, totalLength);
                }
                b = Math.min(b, totalLength - 1);
            }
        } catch (NumberFormatException e) {
            // digits only, so this is overflow
            return Optional.empty();
        }
        return Optional.of(new ByteRange(a, b, totalLength));
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    public long getTotalLength() {
        return totalLength;
    }

    public long length() {
        return end - start + 1;
    }

    public String contentRange() {
        return "bytes " + start + "-" + end + "/" + totalLength;
    }

    @Override
    public String toString() {
        return contentRange();
    }
}
