package com.weixiao.caf.command;

import com.weixiao.caf.Caf;
import com.weixiao.caf.CafTestUtil;
import com.weixiao.caf.CafTestUtil.ExecuteResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HashFileCommand 测试")
class HashFileCommandTest {

    private static final CommandLine CAF = Caf.createCommandLine();

    private static final String HELLO_OID = "b6fc4c620b67d95f953a5c1c1230aaab5db5a1b0";

    @Test
    @DisplayName("不带 -w 时只输出 oid，不需要仓库")
    void hashFile_withoutWrite(@TempDir Path tempDir) throws Exception {
        CafTestUtil.writeFile(tempDir, "hello.txt", "hello");
        ExecuteResult result = CafTestUtil.executeWithCapturedOut(CAF, "-C", tempDir.toString(), "hash-file", "hello.txt");

        assertThat(result.getExitCode()).isEqualTo(0);
        assertThat(result.getOutput().trim()).isEqualTo("Hash: " + HELLO_OID);
        assertThat(tempDir.resolve(".caf")).doesNotExist();
    }

    @Test
    @DisplayName("-w 写入对象库")
    void hashFile_write(@TempDir Path tempDir) throws Exception {
        CafTestUtil.executeWithCapturedOut(CAF, "-C", tempDir.toString(), "init");
        CafTestUtil.writeFile(tempDir, "hello.txt", "hello");
        ExecuteResult result = CafTestUtil.executeWithCapturedOut(CAF, "-C", tempDir.toString(),
                "hash-file", "-w", "hello.txt");

        assertThat(result.getExitCode()).isEqualTo(0);
        assertThat(result.getOutput()).contains("Hash: " + HELLO_OID).contains("Saved file hello.txt");
        assertThat(tempDir.resolve(".caf/objects/b6/" + HELLO_OID)).isRegularFile();
    }

    @Test
    @DisplayName("-w 但不在仓库中时失败")
    void hashFile_writeOutsideRepo_fails(@TempDir Path tempDir) throws Exception {
        CafTestUtil.writeFile(tempDir, "hello.txt", "hello");
        ExecuteResult result = CafTestUtil.executeWithCapturedOut(CAF, "-C", tempDir.toString(),
                "hash-file", "-w", "hello.txt");
        assertThat(result.getExitCode()).isEqualTo(1);
        assertThat(result.getErr()).contains("not a caf repository");
    }

    @Test
    @DisplayName("文件不存在时失败")
    void hashFile_missing_fails(@TempDir Path tempDir) {
        ExecuteResult result = CafTestUtil.executeWithCapturedOut(CAF, "-C", tempDir.toString(), "hash-file", "nope.txt");
        assertThat(result.getExitCode()).isEqualTo(1);
        assertThat(result.getErr()).contains("does not exist");
    }
}
