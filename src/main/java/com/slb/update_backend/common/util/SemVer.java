package com.slb.update_backend.common.util;

import java.util.List;
import java.util.Objects;

/**
 * 已解析的语义化版本（SemVer 2.0）。
 *
 * <p>相等性与排序只看 major/minor/patch 与 pre-release；build metadata 仅用于回显。</p>
 */
public final class SemVer implements Comparable<SemVer> {

    private final long major;
    private final long minor;
    private final long patch;
    private final List<String> prerelease;
    private final List<String> build;

    public SemVer(long major, long minor, long patch, List<String> prerelease, List<String> build) {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("version numbers must be non-negative");
        }
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.prerelease = prerelease == null ? List.of() : List.copyOf(prerelease);
        this.build = build == null ? List.of() : List.copyOf(build);
    }

    public long major() {
        return major;
    }

    public long minor() {
        return minor;
    }

    public long patch() {
        return patch;
    }

    public List<String> prerelease() {
        return prerelease;
    }

    public List<String> build() {
        return build;
    }

    public boolean isPrerelease() {
        return !prerelease.isEmpty();
    }

    @Override
    public int compareTo(SemVer other) {
        return VersionUtil.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SemVer other)) return false;
        return major == other.major
                && minor == other.minor
                && patch == other.patch
                && prerelease.equals(other.prerelease);
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch, prerelease);
    }

    @Override
    public String toString() {
        return VersionUtil.format(this);
    }
}
