package com.weixiao.caf.repo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * 工作区：列出、读取、写入与删除工作目录中的文件（排除仓库元数据目录）。
 * 对外的相对路径统一用 "/" 分隔，如 "dir/sub/file.txt"。
 */
public final class Workspace {

    private static final Logger log = LoggerFactory.getLogger(Workspace.class);

    private final Path root;
    private final String repoDirName;

    /**
     * @param root        工作区根目录
     * @param repoDirName 元数据目录名（如 .caf），列目录时跳过
     */
    public Workspace(Path root, String repoDirName) {
        this.root = root.toAbsolutePath().normalize();
        this.repoDirName = repoDirName;
    }

    /**
     * 列出指定目录下的所有条目（文件和子目录），排除元数据目录，按文件名排序。
     * 目录不存在时返回空列表。
     */
    public List<Path> listEntries(Path dir) throws IOException {
        List<Path> entries = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return entries;
        }
        try (Stream<Path> stream = Files.list(dir)) {
            for (Path p : (Iterable<Path>) stream::iterator) {
                if (repoDirName.equals(p.getFileName().toString())) continue;
                entries.add(p);
            }
        }
        entries.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return entries;
    }

    /** 工作区内相对路径对应的绝对路径。 */
    public Path resolve(String relativePath) {
        return root.resolve(relativePath);
    }

    /** 绝对路径相对工作区根的 "/" 分隔路径。 */
    public String relativize(Path path) {
        return Refs.toSlashPath(root.relativize(path.toAbsolutePath().normalize()));
    }

    public boolean isFile(String relativePath) {
        return Files.isRegularFile(resolve(relativePath), LinkOption.NOFOLLOW_LINKS);
    }

    public boolean isDirectory(String relativePath) {
        return Files.isDirectory(resolve(relativePath), LinkOption.NOFOLLOW_LINKS);
    }

    /** 读取相对路径文件的全部字节。 */
    public byte[] readFile(String relativePath) throws IOException {
        return Files.readAllBytes(resolve(relativePath));
    }

    /** 写入文件，父目录不存在时创建。 */
    public void writeFile(String relativePath, byte[] data) throws IOException {
        Path file = resolve(relativePath);
        Path dir = file.getParent();
        if (dir != null && !Files.isDirectory(dir)) {
            Files.createDirectories(dir);
        }
        Files.write(file, data);
        log.debug("wrote {} ({} bytes)", relativePath, data.length);
    }

    /** 创建目录（含父目录）。 */
    public void createDirectory(String relativePath) throws IOException {
        Files.createDirectories(resolve(relativePath));
    }

    /**
     * 删除文件，然后自下而上删除因此变空的父目录，直到工作区根为止。
     */
    public void deleteFile(String relativePath) throws IOException {
        Path file = resolve(relativePath);
        Files.deleteIfExists(file);
        Path dir = file.getParent();
        while (dir != null && !dir.equals(root) && dir.startsWith(root) && isEmptyDirectory(dir)) {
            Files.delete(dir);
            log.debug("pruned empty directory {}", dir);
            dir = dir.getParent();
        }
    }

    /**
     * 工作目录快照：相对路径到 blob oid 的映射，按路径排序。
     * 只读取普通文件，不写入对象库。
     */
    public Map<String, String> snapshot(ObjectCodec codec) throws IOException {
        Map<String, String> files = new TreeMap<>();
        Deque<Path> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Path dir = stack.pop();
            for (Path p : listEntries(dir)) {
                if (Files.isDirectory(p, LinkOption.NOFOLLOW_LINKS)) {
                    stack.push(p);
                } else if (Files.isRegularFile(p)) {
                    files.put(relativize(p), codec.hashFile(p));
                }
            }
        }
        log.debug("snapshot root={} files={}", root, files.size());
        return files;
    }

    /** 工作区根目录路径。 */
    public Path getRoot() {
        return root;
    }

    public String getRepoDirName() {
        return repoDirName;
    }

    private static boolean isEmptyDirectory(Path dir) throws IOException {
        if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
            return false;
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.findAny().isEmpty();
        }
    }
}
