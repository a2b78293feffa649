package com.slb.update_backend.common.util;

import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Tauri target 归一化与回退链。
 *
 * <p>别名表与回退表都是手工维护的不可变 Map；新增可接受的平台时必须同步补充回退表
 * （没有回退也要写空列表），测试会校验这一点。</p>
 */
public final class PlatformUtil {

    /**
     * 更新包（updater artifact）可接受的平台：Tauri 官方 target。
     */
    public static final Set<String> ARTIFACT_PLATFORMS = Set.of(
            "darwin-aarch64",
            "darwin-x86_64",
            "linux-x86_64",
            "linux-aarch64",
            "windows-x86_64",
            "windows-aarch64"
    );

    /**
     * 安装包平台：在 artifact 平台基础上，额外允许 universal / 32 位产物。
     */
    public static final Set<String> INSTALLER_PLATFORMS = Set.of(
            "darwin-aarch64",
            "darwin-x86_64",
            "linux-x86_64",
            "linux-aarch64",
            "windows-x86_64",
            "windows-aarch64",
            "darwin-universal",
            "windows-x86",
            "linux-armv7"
    );

    // 整串别名：客户端只报了 OS 或历史写法
    private static final Map<String, String> WHOLE_ALIASES = Map.of(
            "macos", "darwin",
            "osx", "darwin",
            "mac", "darwin",
            "win", "windows",
            "win64", "windows-x86_64",
            "win32", "windows-x86_64",
            "linux64", "linux-x86_64"
    );

    private static final Map<String, String> OS_ALIASES = Map.of(
            "macos", "darwin",
            "osx", "darwin",
            "mac", "darwin",
            "win", "windows"
    );

    private static final Map<String, String> ARCH_ALIASES = Map.of(
            "amd64", "x86_64",
            "x64", "x86_64",
            "arm64", "aarch64",
            "i686", "x86",
            "i386", "x86"
    );

    private static final Map<String, List<String>> FALLBACKS = Map.of(
            "darwin-aarch64", List.of("darwin-universal"),
            "darwin-x86_64", List.of("darwin-universal"),
            "darwin-universal", List.of(),
            "windows-aarch64", List.of("windows-x86_64", "windows-x86"),
            "windows-x86_64", List.of("windows-x86"),
            "windows-x86", List.of(),
            "linux-x86_64", List.of(),
            "linux-aarch64", List.of(),
            "linux-armv7", List.of()
    );

    private PlatformUtil() {
    }

    /**
     * 归一化为 canonical {os}-{arch}。未知字符串只做 trim + 小写后原样返回，从不拒绝。
     */
    public static String normalize(@Nullable String raw) {
        if (raw == null) return "";
        String s = raw.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) return s;

        String whole = WHOLE_ALIASES.get(s);
        if (whole != null) return whole;

        int dash = s.indexOf('-');
        if (dash <= 0 || dash == s.length() - 1) return s;

        String os = s.substring(0, dash);
        String arch = s.substring(dash + 1);
        return OS_ALIASES.getOrDefault(os, os) + "-" + ARCH_ALIASES.getOrDefault(arch, arch);
    }

    /**
     * 该平台还能运行的“更宽松”平台，按优先级排列；未登记的平台返回空列表。
     */
    public static List<String> fallbackChain(@Nullable String canonicalPlatform) {
        if (canonicalPlatform == null) return List.of();
        return FALLBACKS.getOrDefault(canonicalPlatform, List.of());
    }

    /**
     * 精确平台在前，随后依次是回退平台。
     */
    public static List<String> resolutionOrder(String canonicalPlatform) {
        List<String> chain = fallbackChain(canonicalPlatform);
        List<String> order = new ArrayList<>(chain.size() + 1);
        order.add(canonicalPlatform);
        order.addAll(chain);
        return order;
    }

    public static boolean isArtifactPlatform(@Nullable String canonicalPlatform) {
        return canonicalPlatform != null && ARTIFACT_PLATFORMS.contains(canonicalPlatform);
    }

    public static boolean isInstallerPlatform(@Nullable String canonicalPlatform) {
        return canonicalPlatform != null && INSTALLER_PLATFORMS.contains(canonicalPlatform);
    }

    static Set<String> platformsWithFallbackEntry() {
        return FALLBACKS.keySet();
    }
}
