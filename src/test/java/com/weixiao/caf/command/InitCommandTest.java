package com.weixiao.caf.command;

import com.weixiao.caf.Caf;
import com.weixiao.caf.CafTestUtil;
import com.weixiao.caf.CafTestUtil.ExecuteResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * caf init / delete-repo 命令测试。
 */
@DisplayName("InitCommand 测试")
class InitCommandTest {

    private static final CommandLine CAF = Caf.createCommandLine();

    /**
     * init 创建 .caf/objects、refs/heads、refs/tags 与 HEAD，HEAD 指向 main。
     */
    @Test
    @DisplayName("init 创建元数据目录结构")
    void init_createsLayout(@TempDir Path tempDir) throws Exception {
        ExecuteResult result = CafTestUtil.executeWithCapturedOut(CAF, "-C", tempDir.toString(), "init");

        assertThat(result.getExitCode()).isEqualTo(0);
        assertThat(result.getOutput()).contains("Initialized empty CAF repository").contains("main");
        Path caf = tempDir.resolve(".caf");
        assertThat(caf.resolve("objects")).isDirectory();
        assertThat(caf.resolve("refs/heads/main")).isRegularFile();
        assertThat(caf.resolve("refs/tags")).isDirectory();
        assertThat(new String(Files.readAllBytes(caf.resolve("HEAD")), StandardCharsets.UTF_8).trim())
                .isEqualTo("ref: refs/heads/main");
    }

    @Test
    @DisplayName("init -b 指定默认分支")
    void init_withBranch(@TempDir Path tempDir) {
        ExecuteResult result = CafTestUtil.executeWithCapturedOut(CAF, "-C", tempDir.toString(), "init", "-b", "trunk");
        assertThat(result.getExitCode()).isEqualTo(0);
        assertThat(tempDir.resolve(".caf/refs/heads/trunk")).isRegularFile();
    }

    @Test
    @DisplayName("重复 init 失败")
    void init_twice_fails(@TempDir Path tempDir) {
        CafTestUtil.executeWithCapturedOut(CAF, "-C", tempDir.toString(), "init");
        ExecuteResult result = CafTestUtil.executeWithCapturedOut(CAF, "-C", tempDir.toString(), "init");
        assertThat(result.getExitCode()).isEqualTo(1);
        assertThat(result.getErr()).contains("already exists");
    }

    @Test
    @DisplayName("--repo-dir 使用自定义元数据目录名")
    void init_customRepoDir(@TempDir Path tempDir) {
        ExecuteResult result = CafTestUtil.executeWithCapturedOut(CAF,
                "-C", tempDir.toString(), "--repo-dir", ".meta", "init");
        assertThat(result.getExitCode()).isEqualTo(0);
        assertThat(tempDir.resolve(".meta/HEAD")).isRegularFile();
        assertThat(tempDir.resolve(".caf")).doesNotExist();
    }

    @Test
    @DisplayName("delete-repo 删除元数据目录，之后命令找不到仓库")
    void deleteRepo_removesMetadata(@TempDir Path tempDir) throws Exception {
        CafTestUtil.executeWithCapturedOut(CAF, "-C", tempDir.toString(), "init");
        CafTestUtil.writeFile(tempDir, "keep.txt", "k");

        ExecuteResult result = CafTestUtil.executeWithCapturedOut(CAF, "-C", tempDir.toString(), "delete-repo");
        assertThat(result.getExitCode()).isEqualTo(0);
        assertThat(tempDir.resolve(".caf")).doesNotExist();
        assertThat(tempDir.resolve("keep.txt")).isRegularFile();

        ExecuteResult after = CafTestUtil.executeWithCapturedOut(CAF, "-C", tempDir.toString(), "branch");
        assertThat(after.getExitCode()).isEqualTo(1);
        assertThat(after.getErr()).contains("not a caf repository");
    }
}
