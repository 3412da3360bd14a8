package com.weixiao.caf.diff;

import com.weixiao.caf.CafTestUtil;
import com.weixiao.caf.errors.CafException;
import com.weixiao.caf.obj.Blob;
import com.weixiao.caf.obj.Tree;
import com.weixiao.caf.obj.TreeRecord;
import com.weixiao.caf.ref.HashRef;
import com.weixiao.caf.repo.ObjectCodec;
import com.weixiao.caf.repo.Repository;
import com.weixiao.caf.repo.RepositoryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TreeDiffer 测试")
class TreeDifferTest {

    private final ObjectCodec codec = new ObjectCodec(RepositoryConfig.SHA1_HEX_LENGTH);
    private final Map<String, Tree> trees = new HashMap<>();
    private TreeDiffer differ;

    @BeforeEach
    void setUp() {
        TreeLookup lookup = hash -> {
            Tree tree = trees.get(hash);
            if (tree == null) {
                throw new IOException("no tree " + hash);
            }
            return tree;
        };
        differ = new TreeDiffer(lookup, lookup);
    }

    private String blob(String content) {
        return codec.hash(new Blob(content.getBytes(StandardCharsets.UTF_8)));
    }

    private Tree tree(TreeRecord... records) {
        return new Tree(List.of(records));
    }

    /** 登记子 tree，返回指向它的记录。 */
    private TreeRecord dir(String name, Tree tree) {
        String hash = codec.hash(tree);
        trees.put(hash, tree);
        return TreeRecord.tree(name, hash);
    }

    private static List<String> describe(TreeDiff diff) {
        return diff.flatten().stream().map(DiffEntry::toString).collect(Collectors.toList());
    }

    @Test
    @DisplayName("相同 tree 的 diff 为空")
    void diff_identical_isEmpty() throws Exception {
        Tree t = tree(TreeRecord.blob("a.txt", blob("a")), dir("d", tree(TreeRecord.blob("b", blob("b")))));
        assertThat(differ.diff(t, t).isEmpty()).isTrue();
        assertThat(differ.diff(null, null).isEmpty()).isTrue();
    }

    /**
     * 旧 tree 的记录先按名字输出，新增的记录随后。
     */
    @Test
    @DisplayName("新增、删除与修改")
    void diff_addedRemovedModified() throws Exception {
        Tree a = tree(TreeRecord.blob("keep", blob("k")), TreeRecord.blob("mod", blob("1")),
                TreeRecord.blob("old", blob("o")));
        Tree b = tree(TreeRecord.blob("keep", blob("k")), TreeRecord.blob("mod", blob("2")),
                TreeRecord.blob("new", blob("n")));

        assertThat(describe(differ.diff(a, b))).containsExactly("MODIFIED mod", "REMOVED old", "ADDED new");
    }

    @Test
    @DisplayName("null 视为空 tree")
    void diff_nullIsEmptyTree() throws Exception {
        Tree b = tree(TreeRecord.blob("x", blob("x")));
        assertThat(describe(differ.diff(null, b))).containsExactly("ADDED x");
        assertThat(describe(differ.diff(b, null))).containsExactly("REMOVED x");
    }

    /**
     * 子目录内容变化时目录本身为 MODIFIED，具体改动挂在它下面；未变化的子目录被剪枝。
     */
    @Test
    @DisplayName("嵌套目录的修改挂在 MODIFIED 节点下")
    void diff_nestedModification() throws Exception {
        Tree same = tree(TreeRecord.blob("s", blob("s")));
        Tree a = tree(dir("same", same), dir("src", tree(TreeRecord.blob("main.c", blob("v1")))));
        Tree b = tree(dir("same", same), dir("src", tree(TreeRecord.blob("main.c", blob("v2")),
                TreeRecord.blob("util.c", blob("u")))));

        TreeDiff diff = differ.diff(a, b);
        assertThat(diff.getRoots()).hasSize(1);
        DiffEntry src = diff.getRoots().get(0);
        assertThat(src.getType()).isEqualTo(DiffType.MODIFIED);
        assertThat(src.getParent()).isNull();
        assertThat(src.getChildren()).extracting(DiffEntry::toString)
                .containsExactly("MODIFIED src/main.c", "ADDED src/util.c");
        assertThat(src.getChildren().get(0).getParent()).isEqualTo(src);
    }

    @Test
    @DisplayName("文件改名识别为一对移动节点")
    void diff_renameIsMovePair() throws Exception {
        Tree a = tree(TreeRecord.blob("before.txt", blob("same content")));
        Tree b = tree(TreeRecord.blob("after.txt", blob("same content")));

        TreeDiff diff = differ.diff(a, b);
        assertThat(describe(diff)).containsExactly("MOVED_TO before.txt", "MOVED_FROM after.txt");
        DiffEntry movedTo = diff.getRoots().get(0);
        assertThat(movedTo.getMovedPair()).isEqualTo(diff.getRoots().get(1));
        assertThat(movedTo.getMovedPair().getMovedPair()).isEqualTo(movedTo);
        assertThat(movedTo.getType().isMove()).isTrue();
    }

    /**
     * 新位置先于旧位置出现时，先产生的 ADDED 节点原地改为 MOVED_FROM。
     */
    @Test
    @DisplayName("跨目录移动被识别，节点位置不变")
    void diff_moveAcrossDirectories() throws Exception {
        String content = blob("payload");
        Tree a = tree(dir("b", tree(TreeRecord.blob("f", content))), TreeRecord.blob("other", blob("o")));
        Tree b = tree(TreeRecord.blob("a-new", content), dir("b", tree(TreeRecord.blob("g", blob("g")))),
                TreeRecord.blob("other", blob("o")));

        TreeDiff diff = differ.diff(a, b);
        List<DiffEntry> all = diff.flatten();
        assertThat(all).extracting(DiffEntry::toString)
                .containsExactly("MODIFIED b", "MOVED_TO b/f", "ADDED b/g", "MOVED_FROM a-new");

        DiffEntry movedFrom = diff.getRoots().get(1);
        assertThat(movedFrom.getType()).isEqualTo(DiffType.MOVED_FROM);
        assertThat(movedFrom.getMovedPair().getPath()).isEqualTo("b/f");
    }

    @Test
    @DisplayName("目录被同名文件替换时只标 MODIFIED，不展开")
    void diff_typeChange() throws Exception {
        Tree a = tree(dir("x", tree(TreeRecord.blob("inner", blob("i")))));
        Tree b = tree(TreeRecord.blob("x", blob("now a file")));

        TreeDiff diff = differ.diff(a, b);
        assertThat(describe(diff)).containsExactly("MODIFIED x");
        assertThat(diff.getRoots().get(0).getChildren()).isEmpty();
    }

    @Test
    @DisplayName("子 tree 加载失败抛 CafException 并保留原因")
    void diff_missingSubtree_throws() {
        Tree a = tree(TreeRecord.tree("d", blob("not a tree 1")));
        Tree b = tree(TreeRecord.tree("d", blob("not a tree 2")));

        assertThatThrownBy(() -> differ.diff(a, b))
                .isInstanceOf(CafException.class)
                .hasMessageContaining("Error loading subtree")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Repository.diff 比较 commit 与目录")
    void repositoryDiff_commitAgainstDirectory(@TempDir Path work) throws Exception {
        Repository repo = new Repository(work);
        repo.init();
        CafTestUtil.writeFile(work, "a.txt", "a");
        CafTestUtil.writeFile(work, "d/b.txt", "b");
        HashRef first = repo.commitWorkingDir("t", "first");

        assertThat(repo.diff().isEmpty()).isTrue();

        CafTestUtil.writeFile(work, "d/b.txt", "changed");
        CafTestUtil.writeFile(work, "c.txt", "c");
        assertThat(describe(repo.diff())).containsExactly("MODIFIED d", "MODIFIED d/b.txt", "ADDED c.txt");

        repo.commitWorkingDir("t", "second");
        assertThat(describe(repo.diff(first.getHash(), "main")))
                .containsExactly("MODIFIED d", "MODIFIED d/b.txt", "ADDED c.txt");
        assertThat(repo.diff("main", "main").isEmpty()).isTrue();
    }

    /**
     * 名字指向已存在的目录时按目录比较。
     */
    @Test
    @DisplayName("名字为目录时优先按目录处理")
    void repositoryDiff_directoryNames(@TempDir Path work) throws Exception {
        Repository repo = new Repository(work);
        repo.init();
        CafTestUtil.writeFile(work, "left/f.txt", "1");
        CafTestUtil.writeFile(work, "right/f.txt", "2");

        assertThat(describe(repo.diff("left", "right"))).containsExactly("MODIFIED f.txt");
        assertThat(describe(repo.diff(DiffSource.of(work.resolve("left")), DiffSource.of(work.resolve("right")))))
                .containsExactly("MODIFIED f.txt");
    }

    @Test
    @DisplayName("未出生分支按空 tree 比较，无法解析的一侧报错")
    void repositoryDiff_unbornAndInvalid(@TempDir Path work) throws Exception {
        Repository repo = new Repository(work);
        repo.init();
        CafTestUtil.writeFile(work, "a.txt", "a");

        assertThat(describe(repo.diff())).containsExactly("ADDED a.txt");
        assertThatThrownBy(() -> repo.diff("no-such-thing", null))
                .isInstanceOf(CafException.class)
                .hasMessage("Error loading commit or tree")
                .hasCauseInstanceOf(CafException.class);
    }
}
