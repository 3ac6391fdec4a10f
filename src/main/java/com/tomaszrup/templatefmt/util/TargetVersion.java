////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.templatefmt.util;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A {@code (major, minor)} template-language release that migrations are
 * gated on. Ordered by major, then minor.
 */
public final class TargetVersion implements Comparable<TargetVersion> {

    private static final Pattern VERSION = Pattern.compile("(\\d+)\\.(\\d+)");

    /** Releases accepted on the command line, oldest first. */
    public static final List<TargetVersion> SUPPORTED = Collections.unmodifiableList(Arrays.asList(
            of(2, 0), of(2, 1), of(2, 2),
            of(3, 0), of(3, 1), of(3, 2),
            of(4, 0), of(4, 1), of(4, 2),
            of(5, 0), of(5, 1), of(5, 2)));

    private final int major;
    private final int minor;

    private TargetVersion(int major, int minor) {
        if (major < 0 || minor < 0) {
            throw new IllegalArgumentException("Version components must not be negative: " + major + "." + minor);
        }
        this.major = major;
        this.minor = minor;
    }

    public static TargetVersion of(int major, int minor) {
        return new TargetVersion(major, minor);
    }

    /**
     * Parse one of the {@link #SUPPORTED} versions, e.g. {@code "4.2"}.
     *
     * @throws IllegalArgumentException if the text is malformed or not supported
     */
    public static TargetVersion parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Missing version");
        }
        Matcher m = VERSION.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid version: " + text + ". Allowed versions are " + supportedList() + ".");
        }
        TargetVersion version;
        try {
            version = of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid version: " + text, e);
        }
        if (!SUPPORTED.contains(version)) {
            throw new IllegalArgumentException("Unsupported version: " + text + ". Allowed versions are " + supportedList() + ".");
        }
        return version;
    }

    /**
     * Map an arbitrary release to the newest supported release not newer
     * than it.
     *
     * @return the supported release, or empty when {@code version} predates all of them
     */
    public static Optional<TargetVersion> floorSupported(TargetVersion version) {
        TargetVersion best = null;
        for (TargetVersion candidate : SUPPORTED) {
            if (candidate.compareTo(version) <= 0) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    public static String supportedList() {
        return SUPPORTED.stream().map(TargetVersion::toString).collect(Collectors.joining(", "));
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public boolean isAtLeast(TargetVersion other) {
        return compareTo(other) >= 0;
    }

    @Override
    public int compareTo(TargetVersion other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        return Integer.compare(minor, other.minor);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TargetVersion)) {
            return false;
        }
        TargetVersion other = (TargetVersion) o;
        return major == other.major && minor == other.minor;
    }

    @Override
    public int hashCode() {
        return 31 * major + minor;
    }

    @Override
    public String toString() {
        return major + "." + minor;
    }
}
