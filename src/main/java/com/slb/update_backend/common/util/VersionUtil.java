package com.slb.update_backend.common.util;

import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 语义化版本解析与比较（严格 SemVer 2.0，不做任何猜测）。
 *
 * 约定：
 * - 只接受 MAJOR.MINOR.PATCH[-PRERELEASE][+BUILD]，"v1.2.3" / "1.2" / 空串都视为无效；
 * - build metadata（+xxxx）不参与比较；
 * - pre-release 低于同 core 的正式版本；
 * - 解析失败返回 Optional.empty()，从不抛异常。
 */
public final class VersionUtil {

    private static final String IDENTIFIERS = "[0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*";

    private static final Pattern SEMVER = Pattern.compile(
            "^(\\d+)\\.(\\d+)\\.(\\d+)(?:-(" + IDENTIFIERS + "))?(?:\\+(" + IDENTIFIERS + "))?$");

    // 与 SemVer 规范一致：带前导零的 "01" 按字符段处理
    private static final Pattern NUMERIC_IDENTIFIER = Pattern.compile("0|[1-9]\\d*");

    /**
     * 新到旧排序；无法解析的版本排在最后。
     */
    public static final Comparator<String> NEWEST_FIRST = (a, b) -> {
        Optional<SemVer> va = parse(a);
        Optional<SemVer> vb = parse(b);
        if (va.isEmpty() && vb.isEmpty()) return 0;
        if (va.isEmpty()) return 1;
        if (vb.isEmpty()) return -1;
        return compare(vb.get(), va.get());
    };

    private VersionUtil() {
    }

    public static Optional<SemVer> parse(@Nullable String text) {
        if (text == null) return Optional.empty();
        Matcher m = SEMVER.matcher(text.trim());
        if (!m.matches()) return Optional.empty();
        try {
            return Optional.of(new SemVer(
                    Long.parseLong(m.group(1)),
                    Long.parseLong(m.group(2)),
                    Long.parseLong(m.group(3)),
                    splitIdentifiers(m.group(4)),
                    splitIdentifiers(m.group(5))));
        } catch (NumberFormatException overflow) {
            return Optional.empty();
        }
    }

    public static boolean isValid(@Nullable String text) {
        return parse(text).isPresent();
    }

    /**
     * 比较两个版本。
     *
     * @return 负数表示 a < b；0 表示同一优先级；正数表示 a > b
     */
    public static int compare(SemVer a, SemVer b) {
        int c = Long.compare(a.major(), b.major());
        if (c != 0) return c;
        c = Long.compare(a.minor(), b.minor());
        if (c != 0) return c;
        c = Long.compare(a.patch(), b.patch());
        if (c != 0) return c;
        return comparePrerelease(a.prerelease(), b.prerelease());
    }

    /**
     * candidate 是否严格新于 current；任一方无法解析时返回 false（无法解析的版本永远不触发更新）。
     */
    public static boolean isNewer(@Nullable String current, @Nullable String candidate) {
        Optional<SemVer> cur = parse(current);
        Optional<SemVer> cand = parse(candidate);
        if (cur.isEmpty() || cand.isEmpty()) return false;
        return compare(cand.get(), cur.get()) > 0;
    }

    public static String format(SemVer v) {
        StringBuilder sb = new StringBuilder()
                .append(v.major()).append('.')
                .append(v.minor()).append('.')
                .append(v.patch());
        if (!v.prerelease().isEmpty()) {
            sb.append('-').append(String.join(".", v.prerelease()));
        }
        if (!v.build().isEmpty()) {
            sb.append('+').append(String.join(".", v.build()));
        }
        return sb.toString();
    }

    public static List<String> sortDescending(List<String> versions) {
        List<String> sorted = new ArrayList<>(versions);
        sorted.sort(NEWEST_FIRST);
        return sorted;
    }

    /**
     * pre-release 比较：
     * - 无 pre-release 的正式版更大；
     * - 逐段比较，数字段按数值，字符段按码点字典序，数字段 < 字符段；
     * - 前面都相同，段数多的更大（alpha < alpha.1）。
     */
    private static int comparePrerelease(List<String> a, List<String> b) {
        if (a.isEmpty() && b.isEmpty()) return 0;
        if (a.isEmpty()) return 1;
        if (b.isEmpty()) return -1;

        int common = Math.min(a.size(), b.size());
        for (int i = 0; i < common; i++) {
            int c = compareIdentifier(a.get(i), b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }

    private static int compareIdentifier(String a, String b) {
        boolean numA = NUMERIC_IDENTIFIER.matcher(a).matches();
        boolean numB = NUMERIC_IDENTIFIER.matcher(b).matches();
        if (numA && numB) {
            // 无前导零，长度更长即数值更大；避免超长数字溢出
            if (a.length() != b.length()) return Integer.compare(a.length(), b.length());
            return a.compareTo(b);
        }
        if (numA) return -1;
        if (numB) return 1;
        return a.compareTo(b);
    }

    private static List<String> splitIdentifiers(@Nullable String group) {
        if (group == null) return List.of();
        return Arrays.asList(group.split("\\."));
    }
}
