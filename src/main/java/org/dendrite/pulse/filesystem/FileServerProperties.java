package org.dendrite.pulse.filesystem;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 文件服务的业务配置（{@code app.fs.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #roots} 声明对外暴露的虚拟根目录，每个虚拟根对应宿主机上的一个源目录。</li>
 *   <li>通过 limit 配置控制目录列表的分页大小与上限。</li>
 *   <li>通过 {@link #listTimeout} 控制单次目录列表请求的最长耗时（超时后中止枚举）。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.fs")
public class FileServerProperties {

    /**
     * {@code page[limit]} 的接口上限。
     */
    public static final int PAGE_LIMIT_CEILING = 500;

    /**
     * 虚拟根目录定义。
     * <p>
     * 说明：
     * <ul>
     *   <li>virtual 只能是 {@code /} 或单级目录（例如 {@code /public}），不允许包含冒号或首尾空白。</li>
     *   <li>source 必须是以 {@code /} 开头的绝对路径；启动时会解析符号链接并校验目录存在。</li>
     * </ul>
     */
    @NotEmpty
    @Valid
    private List<Root> roots = new ArrayList<>();

    /**
     * 目录列表默认返回条数（{@code page[limit]} 缺省值），不能超过 {@link #listMaxLimit}。
     */
    @Min(1)
    @Max(PAGE_LIMIT_CEILING)
    private int listDefaultLimit = 200;

    /**
     * 目录列表允许的最大返回条数（{@code page[limit]} 上限）。
     * <p>
     * 对外接口约定上限为 500，这里只允许调小，不允许调大。
     */
    @Min(1)
    @Max(PAGE_LIMIT_CEILING)
    private int listMaxLimit = PAGE_LIMIT_CEILING;

    /**
     * 单次目录列表的超时时间；超时后在下一个子条目处中止。
     */
    @NotNull
    private Duration listTimeout = Duration.ofSeconds(30);

    public List<Root> getRoots() {
        return roots;
    }

    public void setRoots(List<Root> roots) {
        this.roots = roots;
    }

    public int getListDefaultLimit() {
        return listDefaultLimit;
    }

    public void setListDefaultLimit(int listDefaultLimit) {
        this.listDefaultLimit = listDefaultLimit;
    }

    public int getListMaxLimit() {
        return listMaxLimit;
    }

    public void setListMaxLimit(int listMaxLimit) {
        this.listMaxLimit = listMaxLimit;
    }

    public Duration getListTimeout() {
        return listTimeout;
    }

    public void setListTimeout(Duration listTimeout) {
        this.listTimeout = listTimeout;
    }

    @AssertTrue(message = "list-default-limit 不能大于 list-max-limit")
    public boolean isDefaultLimitWithinMax() {
        return listDefaultLimit <= listMaxLimit;
    }

    /**
     * 转换为注册表使用的根目录定义列表。
     */
    public List<RootDefinition> toDefinitions() {
        List<RootDefinition> result = new ArrayList<>(roots.size());
        for (Root root : roots) {
            result.add(new RootDefinition(root.getVirtual(), root.getSource()));
        }
        return result;
    }

    /**
     * 单个虚拟根目录的配置项（{@code app.fs.roots[i]}）。
     */
    public static class Root {

        @NotNull
        @Pattern(regexp = "/|/[^/:\\s]([^/:]*[^/:\\s])?",
                message = "virtual 必须是 '/' 或单级目录（例如 '/public'），且不能包含冒号或首尾空白")
        private String virtual;

        @NotNull
        @Pattern(regexp = "/([^:]*[^:\\s])?",
                message = "source 必须是以 '/' 开头的绝对路径，且不能包含冒号或首尾空白")
        private String source;

        public Root() {
        }

        public Root(String virtual, String source) {
            this.virtual = virtual;
            this.source = source;
        }

        public String getVirtual() {
            return virtual;
        }

        public void setVirtual(String virtual) {
            this.virtual = virtual;
        }

        public String getSource() {
            return source;
        }

        public void setSource(String source) {
            this.source = source;
        }
    }
}
