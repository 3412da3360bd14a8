package com.weixiao.caf.repo;

import com.weixiao.caf.CafTestUtil;
import com.weixiao.caf.obj.Tree;
import com.weixiao.caf.obj.TreeRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TreeBuilder 测试")
class TreeBuilderTest {

    private static TreeBuilder builder(Path root) {
        return new TreeBuilder(new ObjectCodec(RepositoryConfig.SHA1_HEX_LENGTH), new Workspace(root, ".caf"));
    }

    /**
     * 根 tree 的记录按名字排序，子目录以 tree 记录引用，子 tree 可以从 subtrees 中按 oid 取到。
     */
    @Test
    @DisplayName("构建嵌套目录得到排序的 tree 与子 tree 表")
    void build_nestedDirectories(@TempDir Path root) throws Exception {
        CafTestUtil.writeFile(root, "b.txt", "b");
        CafTestUtil.writeFile(root, "a/x.txt", "x");
        CafTestUtil.writeFile(root, "a/deep/y.txt", "y");

        TreeBuilder.BuildResult result = builder(root).build(root);
        Tree tree = result.getTree();
        assertThat(tree.getRecords().keySet()).containsExactly("a", "b.txt");

        TreeRecord a = tree.get("a");
        assertThat(a.isTree()).isTrue();
        Tree aTree = result.getSubtrees().get(a.getHash());
        assertThat(aTree.getRecords().keySet()).containsExactly("deep", "x.txt");
        assertThat(result.getSubtrees()).containsKey(aTree.get("deep").getHash());
        assertThat(result.getSubtrees().get(result.getHash())).isEqualTo(tree);
        assertThat(result.getBlobSources()).hasSize(3);
    }

    /**
     * 同样内容的两个目录（文件创建顺序不同）得到同一个 oid。
     */
    @Test
    @DisplayName("tree oid 与文件创建顺序无关")
    void build_isDeterministic(@TempDir Path base) throws Exception {
        Path one = base.resolve("one");
        Path two = base.resolve("two");
        CafTestUtil.writeFile(one, "z.txt", "z");
        CafTestUtil.writeFile(one, "m/n.txt", "n");
        CafTestUtil.writeFile(one, "a.txt", "a");
        CafTestUtil.writeFile(two, "a.txt", "a");
        CafTestUtil.writeFile(two, "m/n.txt", "n");
        CafTestUtil.writeFile(two, "z.txt", "z");

        assertThat(builder(one).build(one).getHash()).isEqualTo(builder(two).build(two).getHash());
    }

    /**
     * 元数据目录不参与构建；构建过程不写任何对象。
     */
    @Test
    @DisplayName("跳过元数据目录且不写对象库")
    void build_skipsRepoDir(@TempDir Path root) throws Exception {
        CafTestUtil.writeFile(root, "file.txt", "f");
        Files.createDirectories(root.resolve(".caf/objects"));

        TreeBuilder.BuildResult result = builder(root).build(root);
        assertThat(result.getTree().getRecords().keySet()).containsExactly("file.txt");
        try (var files = Files.list(root.resolve(".caf/objects"))) {
            assertThat(files.count()).isZero();
        }
    }

    /**
     * 很深的目录层级也能构建（显式栈）。
     */
    @Test
    @DisplayName("深层目录构建成功")
    void build_deepHierarchy(@TempDir Path root) throws Exception {
        StringBuilder path = new StringBuilder();
        for (int i = 0; i < 60; i++) {
            path.append("d").append('/');
        }
        CafTestUtil.writeFile(root, path + "leaf.txt", "leaf");
        TreeBuilder.BuildResult result = builder(root).build(root);
        assertThat(result.getSubtrees()).hasSize(61);
    }

    @Test
    @DisplayName("不是目录时抛 IllegalArgumentException")
    void build_notDirectory_throws(@TempDir Path root) throws Exception {
        Path file = CafTestUtil.writeFile(root, "f.txt", "f");
        assertThatThrownBy(() -> builder(root).build(file)).isInstanceOf(IllegalArgumentException.class);
    }
}
