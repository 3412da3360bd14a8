package com.weixiao.caf.repo;

import com.weixiao.caf.errors.CafException;
import com.weixiao.caf.errors.ConflictException;
import com.weixiao.caf.errors.InvalidReferenceException;
import com.weixiao.caf.errors.NotFoundException;
import com.weixiao.caf.ref.HashRef;
import com.weixiao.caf.ref.Ref;
import com.weixiao.caf.ref.SymRef;
import com.weixiao.caf.utils.HexUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 引用：读写 HEAD 与 refs 下的 ref 文件，并把引用或字符串解析为 commit oid。
 * <p>
 * ref 文件格式："ref: &lt;path&gt;" 表示 SymRef，40 位 hex 表示 HashRef，空文件表示未出生的分支。
 * SymRef 的 name 相对仓库目录，如 "refs/heads/main"。
 */
public final class Refs {

    private static final Logger log = LoggerFactory.getLogger(Refs.class);

    /** 解析 SymRef 时允许的最大间接层数，防止 ref 之间成环。 */
    static final int MAX_SYMREF_DEPTH = 5;

    private final Path repoDir;
    private final Path refsDir;
    private final Path headsDir;
    private final Path tagsDir;
    private final Path headFile;
    private final int hashLength;

    /**
     * 以仓库目录（如 &lt;work&gt;/.caf）为基准，HEAD 与 refs 路径均相对于 repoDir。
     */
    public Refs(Path repoDir, RepositoryConfig config) {
        this.repoDir = repoDir;
        this.refsDir = repoDir.resolve(config.getRefsDir());
        this.headsDir = refsDir.resolve(config.getHeadsDir());
        this.tagsDir = refsDir.resolve(config.getTagsDir());
        this.headFile = repoDir.resolve(config.getHeadFile());
        this.hashLength = config.getHashLength();
    }

    /**
     * 读取 HEAD 的值（SymRef 或 HashRef）。
     *
     * @throws NotFoundException HEAD 文件不存在
     */
    public Ref readHead() throws IOException {
        if (!Files.exists(headFile)) {
            throw new NotFoundException("HEAD ref file does not exist");
        }
        return readRef(headFile);
    }

    /** 写入 HEAD。 */
    public void writeHead(Ref ref) throws IOException {
        writeRef(headFile, ref);
        log.debug("HEAD -> {}", ref);
    }

    /**
     * 读取一个 ref 文件；空文件（未出生分支）返回 null。
     */
    public Ref readRef(Path file) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8).trim();
        if (content.isEmpty()) {
            return null;
        }
        if (content.startsWith(SymRef.PREFIX)) {
            return new SymRef(content.substring(SymRef.PREFIX.length()).trim());
        }
        if (HexUtils.isHash(content, hashLength)) {
            return new HashRef(content);
        }
        throw new InvalidReferenceException("invalid ref file content in " + file + ": " + content);
    }

    /** 写 ref 文件；ref 为 null 时写空文件。 */
    public void writeRef(Path file, Ref ref) throws IOException {
        Path dir = file.getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
        }
        Files.writeString(file, ref == null ? "" : ref.toRefString() + "\n", StandardCharsets.UTF_8);
    }

    /**
     * 把用户输入的字符串归类为引用，按以下顺序探测：
     * HEAD（不区分大小写）、已存在的 ref 名（refs/...、heads/x、分支短名、标签短名）、合法 oid。
     * ref 名优先于 oid，因此名字恰好像 oid 的分支仍按分支处理。
     *
     * @return null 输入返回 null
     * @throws InvalidReferenceException 既不是已知 ref 也不是合法 oid
     * @throws ConflictException         短名同时是分支和标签
     */
    public Ref classify(String name) throws IOException {
        if (name == null) {
            return null;
        }
        if (SymRef.HEAD.equalsIgnoreCase(name)) {
            return new SymRef(SymRef.HEAD);
        }
        Path file = locate(name);
        if (file != null) {
            return new SymRef(relativeName(file));
        }
        if (HexUtils.isHash(name, hashLength)) {
            return new HashRef(name);
        }
        throw new InvalidReferenceException("Invalid reference: " + name);
    }

    /**
     * 解析字符串为 commit oid，见 {@link #classify(String)} 与 {@link #resolve(Ref)}。
     */
    public HashRef resolve(String name) throws IOException {
        return resolve(classify(name));
    }

    /**
     * 把引用解析为 HashRef：HashRef 即其本身，HEAD 读 HEAD 文件后继续解析，其余 SymRef 读其 ref 文件后继续解析。
     *
     * @return 未出生分支或 null 输入返回 null
     * @throws NotFoundException SymRef 指向的 ref 文件不存在
     */
    public HashRef resolve(Ref ref) throws IOException {
        Ref current = ref;
        for (int depth = 0; depth <= MAX_SYMREF_DEPTH; depth++) {
            if (current == null) {
                return null;
            }
            if (current instanceof HashRef) {
                return (HashRef) current;
            }
            SymRef sym = (SymRef) current;
            if (sym.isHead()) {
                current = readHead();
                continue;
            }
            Path file = locate(sym.getName());
            if (file == null) {
                throw new NotFoundException("Reference \"" + sym.getName() + "\" does not exist.");
            }
            current = readRef(file);
        }
        throw new InvalidReferenceException("too many levels of symbolic references: " + ref);
    }

    /**
     * 更新一个已存在的 ref。
     *
     * @param name ref 名，可为 "refs/heads/x"、"heads/x" 或短名
     * @throws NotFoundException ref 不存在
     */
    public void updateRef(String name, Ref newRef) throws IOException {
        Path file = locate(name);
        if (file == null) {
            throw new NotFoundException("Reference \"" + name + "\" does not exist.");
        }
        writeRef(file, newRef);
        log.debug("updateRef {} -> {}", relativeName(file), newRef);
    }

    /**
     * 列出 refs 下全部 ref 文件，按名字排序。
     *
     * @throws CafException refs 目录不存在或不是目录
     */
    public List<SymRef> refs() throws IOException {
        if (!Files.isDirectory(refsDir)) {
            throw new CafException("Refs directory does not exist or is not a directory: " + refsDir);
        }
        List<SymRef> result = new ArrayList<>();
        for (String name : listRefFiles(refsDir)) {
            result.add(new SymRef(relativeName(refsDir.resolve(name))));
        }
        return result;
    }

    /** 分支名列表（相对 refs/heads），已排序。 */
    public List<String> branches() throws IOException {
        return listRefFiles(headsDir);
    }

    /** 标签名列表（相对 refs/tags），已排序。 */
    public List<String> tags() throws IOException {
        return listRefFiles(tagsDir);
    }

    public boolean branchExists(String branch) {
        return Files.isRegularFile(branchFile(branch));
    }

    public boolean tagExists(String tag) {
        return Files.isRegularFile(tagFile(tag));
    }

    /** refs/heads/&lt;branch&gt; 文件路径。 */
    public Path branchFile(String branch) {
        return headsDir.resolve(branch);
    }

    /** refs/tags/&lt;tag&gt; 文件路径。 */
    public Path tagFile(String tag) {
        return tagsDir.resolve(tag);
    }

    public Path getHeadFile() {
        return headFile;
    }

    public Path getRefsDir() {
        return refsDir;
    }

    public Path getHeadsDir() {
        return headsDir;
    }

    public Path getTagsDir() {
        return tagsDir;
    }

    /**
     * 查找名字对应的 ref 文件，未找到返回 null。
     * 依次尝试：以 refs/ 开头的完整路径、相对 refs 的路径（如 heads/main）、分支短名、标签短名。
     */
    Path locate(String name) throws ConflictException {
        if (name == null || name.isEmpty() || !isSafeName(name)) {
            return null;
        }
        if (name.startsWith("refs/")) {
            Path file = repoDir.resolve(name);
            return Files.isRegularFile(file) ? file : null;
        }
        Path underRefs = refsDir.resolve(name);
        if (Files.isRegularFile(underRefs)) {
            return underRefs;
        }
        boolean branch = branchExists(name);
        boolean tag = tagExists(name);
        if (branch && tag) {
            throw new ConflictException("ambiguous reference \"" + name + "\": both a branch and a tag");
        }
        if (branch) {
            return branchFile(name);
        }
        return tag ? tagFile(name) : null;
    }

    /**
     * ref 名检查：非空，不是绝对路径，不含 ".." 或空的路径段，不含反斜杠与空白。
     */
    public static boolean isSafeName(String name) {
        if (name == null || name.isEmpty() || name.startsWith("/") || name.endsWith("/")) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '\\' || Character.isWhitespace(c) || c == 0) return false;
        }
        for (String part : name.split("/")) {
            if (part.isEmpty() || part.equals(".") || part.equals("..")) return false;
        }
        return true;
    }

    private String relativeName(Path file) {
        return toSlashPath(repoDir.relativize(file));
    }

    private static List<String> listRefFiles(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return Collections.emptyList();
        }
        try (Stream<Path> stream = Files.walk(dir)) {
            return stream.filter(Files::isRegularFile)
                    .map(p -> toSlashPath(dir.relativize(p)))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    static String toSlashPath(Path relative) {
        StringBuilder sb = new StringBuilder();
        for (Path part : relative) {
            if (sb.length() > 0) sb.append('/');
            sb.append(part.getFileName().toString());
        }
        return sb.toString();
    }
}
