package com.weixiao.caf.repo;

import com.weixiao.caf.CafTestUtil;
import com.weixiao.caf.errors.ConflictException;
import com.weixiao.caf.errors.MergeInProgressException;
import com.weixiao.caf.errors.NotFoundException;
import com.weixiao.caf.errors.RepositoryNotFoundException;
import com.weixiao.caf.obj.Commit;
import com.weixiao.caf.obj.Tree;
import com.weixiao.caf.ref.HashRef;
import com.weixiao.caf.ref.SymRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Repository 测试")
class RepositoryTest {

    @TempDir
    Path work;

    private Repository repo;

    @BeforeEach
    void setUp() throws Exception {
        repo = new Repository(work);
        repo.init();
    }

    @Test
    @DisplayName("重复 init 抛 ConflictException")
    void init_twice_conflicts() {
        assertThatThrownBy(() -> repo.init()).isInstanceOf(ConflictException.class)
                .hasMessageContaining("already exists");
    }

    @Test
    @DisplayName("init 指定默认分支")
    void init_customBranch(@TempDir Path other) throws Exception {
        Repository r = new Repository(other);
        r.init("trunk");
        assertThat(r.currentBranch()).isEqualTo("trunk");
        assertThat(r.branches()).containsExactly("trunk");
    }

    @Test
    @DisplayName("未初始化的目录上操作抛 RepositoryNotFoundException")
    void notInitialized_throws(@TempDir Path other) {
        Repository r = new Repository(other);
        assertThat(r.exists()).isFalse();
        assertThatThrownBy(r::headRef).isInstanceOf(RepositoryNotFoundException.class);
        assertThatThrownBy(r::branches).isInstanceOf(RepositoryNotFoundException.class);
    }

    @Test
    @DisplayName("find 从子目录向上找到仓库")
    void find_walksUp() throws Exception {
        Path sub = Files.createDirectories(work.resolve("a/b"));
        Repository found = Repository.find(sub);
        assertThat(found).isNotNull();
        assertThat(found.getWorkingDir()).isEqualTo(work.toAbsolutePath().normalize());
    }

    /**
     * 第一次提交是根提交，第二次以第一次为父；分支跟随移动。
     */
    @Test
    @DisplayName("提交移动当前分支并串起父提交")
    void commit_movesBranch() throws Exception {
        CafTestUtil.writeFile(work, "a.txt", "1");
        HashRef first = repo.commitWorkingDir("alice", "first");
        CafTestUtil.writeFile(work, "a.txt", "2");
        HashRef second = repo.commitWorkingDir("alice", "second");

        assertThat(repo.resolveRef("main")).isEqualTo(second);
        Commit c2 = repo.getDatabase().loadCommit(second.getHash());
        assertThat(c2.getParents()).containsExactly(first.getHash());
        assertThat(c2.getAuthor()).isEqualTo("alice");
        assertThat(repo.getDatabase().loadCommit(first.getHash()).getParents()).isEmpty();
    }

    @Test
    @DisplayName("作者或提交信息为空时拒绝")
    void commit_requiresAuthorAndMessage() {
        assertThatThrownBy(() -> repo.commitWorkingDir("", "m"))
                .isInstanceOf(IllegalArgumentException.class).hasMessage("Author is required");
        assertThatThrownBy(() -> repo.commitWorkingDir("a", ""))
                .isInstanceOf(IllegalArgumentException.class).hasMessage("Commit message is required");
    }

    @Test
    @DisplayName("分离 HEAD 时提交直接更新 HEAD")
    void commit_detachedHead() throws Exception {
        CafTestUtil.writeFile(work, "a.txt", "1");
        HashRef first = repo.commitWorkingDir("a", "first");
        repo.writeHead(first);
        CafTestUtil.writeFile(work, "a.txt", "2");
        HashRef second = repo.commitWorkingDir("a", "second");

        assertThat(repo.headRef()).isEqualTo(second);
        assertThat(repo.resolveRef("main")).isEqualTo(first);
    }

    /**
     * log 从新到旧，reset 后可重新遍历。
     */
    @Test
    @DisplayName("log 从新到旧遍历并可重置")
    void log_walksNewestFirst() throws Exception {
        CafTestUtil.writeFile(work, "a.txt", "1");
        HashRef first = repo.commitWorkingDir("a", "first");
        CafTestUtil.writeFile(work, "a.txt", "2");
        HashRef second = repo.commitWorkingDir("a", "second");

        LogWalk walk = repo.log();
        List<HashRef> seen = walk.toList().stream().map(LogEntry::getCommitRef).collect(Collectors.toList());
        assertThat(seen).containsExactly(second, first);
        assertThat(walk.next()).isNull();

        walk.reset();
        assertThat(walk.next().getCommit().getMessage()).isEqualTo("second");
    }

    @Test
    @DisplayName("未出生分支的 log 为空")
    void log_unbornIsEmpty() throws Exception {
        assertThat(repo.log().next()).isNull();
    }

    @Test
    @DisplayName("saveDir 写入全部对象，非目录时拒绝")
    void saveDir_storesTree() throws Exception {
        CafTestUtil.writeFile(work, "d/x.txt", "x");
        HashRef tree = repo.saveDir(work);
        Tree root = repo.getDatabase().loadTree(tree.getHash());
        Tree d = repo.getDatabase().loadTree(root.get("d").getHash());
        assertThat(repo.getDatabase().loadBlob(d.get("x.txt").getHash()).toBytes()).isEqualTo("x".getBytes());

        Path file = work.resolve("d/x.txt");
        assertThatThrownBy(() -> repo.saveDir(file)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("工作目录快照不含元数据目录")
    void snapshot_excludesRepoDir() throws Exception {
        CafTestUtil.writeFile(work, "a.txt", "a");
        CafTestUtil.writeFile(work, "d/b.txt", "b");
        Map<String, String> snapshot = repo.workingDirSnapshot();
        assertThat(snapshot.keySet()).containsExactly("a.txt", "d/b.txt");
        assertThat(snapshot.get("a.txt")).isEqualTo(repo.hashFile(work.resolve("a.txt")));
    }

    @Test
    @DisplayName("新建、重复新建与删除分支")
    void branch_lifecycle() throws Exception {
        repo.addBranch("dev");
        assertThat(repo.branches()).containsExactly("dev", "main");
        assertThatThrownBy(() -> repo.addBranch("dev")).isInstanceOf(ConflictException.class);

        repo.deleteBranch("dev");
        assertThat(repo.branchExists("dev")).isFalse();
        assertThatThrownBy(() -> repo.deleteBranch("dev"))
                .isInstanceOf(NotFoundException.class).hasMessageContaining("does not exist");
    }

    @Test
    @DisplayName("不能删除最后一个分支或当前分支")
    void branch_deleteGuards() throws Exception {
        assertThatThrownBy(() -> repo.deleteBranch("main")).isInstanceOf(IllegalArgumentException.class);
        repo.addBranch("dev");
        assertThatThrownBy(() -> repo.deleteBranch("main")).isInstanceOf(ConflictException.class);
    }

    @Test
    @DisplayName("非法分支名被拒绝")
    void branch_invalidName() {
        assertThatThrownBy(() -> repo.addBranch("../evil")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> repo.addBranch("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("标签创建、冲突与删除")
    void tag_lifecycle() throws Exception {
        CafTestUtil.writeFile(work, "a.txt", "a");
        HashRef commit = repo.commitWorkingDir("a", "m");

        repo.createTag("v1", "HEAD");
        assertThat(repo.tags()).containsExactly("v1");
        assertThat(repo.resolveRef("v1")).isEqualTo(commit);
        assertThat(repo.getRefs().readRef(repo.getRefs().tagFile("v1"))).isEqualTo(commit);

        assertThatThrownBy(() -> repo.createTag("v1", "HEAD"))
                .isInstanceOf(ConflictException.class).hasMessageContaining("already exists");
        assertThatThrownBy(() -> repo.createTag("main", "HEAD"))
                .isInstanceOf(ConflictException.class).hasMessageContaining("branch");
        assertThatThrownBy(() -> repo.createTag("", "HEAD"))
                .isInstanceOf(IllegalArgumentException.class).hasMessage("Tag name is required");
        assertThatThrownBy(() -> repo.createTag("v2", "a".repeat(40)))
                .isInstanceOf(NotFoundException.class).hasMessageContaining("does not exist");

        repo.deleteTag("v1");
        assertThat(repo.tagExists("v1")).isFalse();
        assertThatThrownBy(() -> repo.deleteTag("v1")).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("与标签同名的分支被拒绝")
    void branch_conflictsWithTag() throws Exception {
        CafTestUtil.writeFile(work, "a.txt", "a");
        repo.commitWorkingDir("a", "m");
        repo.createTag("release", "main");
        assertThatThrownBy(() -> repo.addBranch("release")).isInstanceOf(ConflictException.class);
    }

    @Test
    @DisplayName("进入、重复进入与放弃合并")
    void mergeMarker_lifecycle() throws Exception {
        assertThat(repo.isMerging()).isFalse();
        repo.startMerge();
        assertThat(repo.isMerging()).isTrue();
        assertThatThrownBy(repo::startMerge).isInstanceOf(MergeInProgressException.class);

        repo.abortMerge();
        assertThat(repo.isMerging()).isFalse();
        assertThatThrownBy(repo::abortMerge).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("放弃合并不改 HEAD")
    void abortMerge_keepsHead() throws Exception {
        repo.startMerge();
        repo.abortMerge();
        assertThat(repo.headRef()).isEqualTo(SymRef.branch("main"));
    }

    @Test
    @DisplayName("delete 删除元数据目录，保留工作文件")
    void delete_removesRepoDirOnly() throws Exception {
        CafTestUtil.writeFile(work, "keep.txt", "k");
        repo.commitWorkingDir("a", "m");
        repo.delete();
        assertThat(Files.exists(work.resolve(".caf"))).isFalse();
        assertThat(CafTestUtil.readFile(work, "keep.txt")).isEqualTo("k");
        assertThatThrownBy(repo::delete).isInstanceOf(RepositoryNotFoundException.class);
    }

    /**
     * 含换行的 author 被拒绝，不写 commit，分支不动，历史仍可读。
     */
    @Test
    @DisplayName("author 含换行时拒绝提交")
    void commit_rejectsMultiLineAuthor() throws Exception {
        CafTestUtil.writeFile(work, "a.txt", "1");
        HashRef first = repo.commitWorkingDir("alice", "first");
        CafTestUtil.writeFile(work, "a.txt", "2");

        assertThatThrownBy(() -> repo.commitWorkingDir("Alice\nEvil", "msg"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Author must be a single line");
        assertThat(repo.resolveRef("main")).isEqualTo(first);
        assertThat(repo.log().toList()).hasSize(1);
    }
}
