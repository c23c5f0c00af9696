package org.dendrite.pulse.filesystem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 虚拟根目录注册表：启动时构建一次，之后不可变。
 * <p>
 * 构建时会把每个 source 解析为真实路径（跟随符号链接），后续所有越界校验都以该真实路径为基准。
 * 注册表作为普通对象由服务持有，允许多个独立配置的实例并存。
 */
public final class RootRegistry {

    private static final Logger log = LoggerFactory.getLogger(RootRegistry.class);

    private final Map<String, Root> byVirtual;
    private final List<Root> ordered;

    private RootRegistry(List<Root> ordered) {
        this.ordered = List.copyOf(ordered);
        Map<String, Root> map = new LinkedHashMap<>();
        for (Root root : ordered) {
            map.put(root.virtual(), root);
        }
        this.byVirtual = Map.copyOf(map);
    }

    /**
     * 构建注册表。
     *
     * @throws IllegalStateException 列表为空、虚拟名重复、或 source 无法解析为目录时
     */
    public static RootRegistry create(List<RootDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new IllegalStateException("未配置任何虚拟根目录（app.fs.roots）");
        }
        List<Root> ordered = new ArrayList<>(definitions.size());
        Map<String, Root> seen = new LinkedHashMap<>();
        for (int i = 0; i < definitions.size(); i++) {
            RootDefinition definition = Objects.requireNonNull(definitions.get(i), "配置项 app.fs.roots[" + i + "] 不能为空");
            String virtual = definition.virtual();
            if (seen.containsKey(virtual)) {
                throw new IllegalStateException("重复的虚拟根目录：" + virtual);
            }
            Path source;
            try {
                source = Path.of(definition.source()).toRealPath().normalize();
            } catch (IOException e) {
                throw new IllegalStateException("无法解析虚拟根目录 " + virtual + " 的源目录：" + definition.source(), e);
            }
            if (!Files.isDirectory(source)) {
                throw new IllegalStateException("虚拟根目录 " + virtual + " 的源不是目录：" + definition.source());
            }
            Root root = new Root(virtual, source);
            seen.put(virtual, root);
            ordered.add(root);
            log.info("已注册虚拟根目录 {} -> {}", virtual, source);
        }
        return new RootRegistry(ordered);
    }

    /**
     * 按虚拟名称查找根目录；缺少前导 {@code /} 时自动补齐。
     */
    public Optional<Root> lookup(String virtual) {
        if (virtual == null) {
            return Optional.empty();
        }
        String key = virtual.startsWith("/") ? virtual : "/" + virtual;
        return Optional.ofNullable(byVirtual.get(key));
    }

    /**
     * 按配置顺序返回所有根目录的快照。
     */
    public List<Root> all() {
        return ordered;
    }

    /**
     * 是否只有一个虚拟名为 {@code /} 的根目录。
     */
    public boolean isSingleSlashRoot() {
        return ordered.size() == 1 && ordered.get(0).isSlash();
    }

    /**
     * 为虚拟请求路径（以 {@code /} 开头，例如 {@code /public/docs/a.txt}）找到对应的根目录与相对路径。
     * <p>
     * 虚拟名越长越优先；{@code /} 根匹配任意路径；{@code /name} 只匹配 {@code /name} 本身或 {@code /name/...}。
     */
    public Optional<RootMatch> match(String requestPath) {
        List<Root> candidates = new ArrayList<>(ordered);
        candidates.sort(Comparator.comparingInt((Root r) -> r.virtual().length()).reversed());
        for (Root root : candidates) {
            if (root.isSlash()) {
                String rel = requestPath.startsWith("/") ? requestPath.substring(1) : requestPath;
                return Optional.of(new RootMatch(root, rel));
            }
            if (requestPath.equals(root.virtual())) {
                return Optional.of(new RootMatch(root, ""));
            }
            String prefix = root.virtual() + "/";
            if (requestPath.startsWith(prefix)) {
                return Optional.of(new RootMatch(root, requestPath.substring(prefix.length())));
            }
        }
        return Optional.empty();
    }

    /**
     * 虚拟路径匹配结果。
     *
     * @param root    命中的根目录
     * @param relPath 根目录下的相对路径（未清洗）
     */
    public record RootMatch(Root root, String relPath) {
    }
}
