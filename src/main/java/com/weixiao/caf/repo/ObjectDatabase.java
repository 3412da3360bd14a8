package com.weixiao.caf.repo;

import com.weixiao.caf.errors.CorruptObjectException;
import com.weixiao.caf.errors.NotFoundException;
import com.weixiao.caf.obj.Blob;
import com.weixiao.caf.obj.CafObject;
import com.weixiao.caf.obj.Commit;
import com.weixiao.caf.obj.Tree;
import com.weixiao.caf.utils.HexUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.InflaterInputStream;
import java.util.zip.ZipException;

/**
 * &lt;repo&gt;/objects 存储：按 oid 写入/读取对象（"type size\0body"，zlib 压缩），
 * 路径为 objects/&lt;oid 前 2 位&gt;/&lt;oid&gt;。
 * 只追加：对象一旦写入不会被修改或删除，只有整个仓库删除时才会消失。
 */
public final class ObjectDatabase {

    private static final Logger log = LoggerFactory.getLogger(ObjectDatabase.class);

    private final Path objectsDir;
    private final ObjectCodec codec;

    /**
     * @param objectsDir 对象目录（&lt;repo&gt;/objects）
     * @param codec      编解码与 hash
     */
    public ObjectDatabase(Path objectsDir, ObjectCodec codec) {
        this.objectsDir = objectsDir;
        this.codec = codec;
    }

    /**
     * 存储对象，返回 oid。已存在相同 oid 的对象时不再写入（幂等）。
     * 先写临时文件再移动到目标路径，目标路径出现时内容已完整。
     */
    public String store(CafObject object) throws IOException {
        byte[] content = codec.encode(object);
        String oid = codec.hash(object);
        Path objectPath = objectPath(oid);
        if (Files.exists(objectPath)) {
            log.debug("store skipped, object exists oid={}", oid);
            return oid;
        }
        Path dir = objectPath.getParent();
        if (!Files.exists(dir)) {
            Files.createDirectories(dir);
        }
        Path temp = dir.resolve("tmp_obj_" + System.nanoTime());
        try {
            Files.write(temp, deflate(content));
            Files.move(temp, objectPath, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("stored {} oid={} size={}", object.getType(), oid, content.length);
        return oid;
    }

    /**
     * 读取并解码对象。
     *
     * @throws NotFoundException      oid 处没有对象
     * @throws CorruptObjectException 字节无法解压，或无法按 kind 解码
     */
    public <T extends CafObject> T load(String oid, Class<T> kind) throws IOException {
        Path p = objectPath(oid);
        if (!Files.exists(p)) {
            throw new NotFoundException("object not found: " + oid);
        }
        byte[] content;
        try {
            content = inflate(Files.readAllBytes(p));
        } catch (ZipException | EOFException e) {
            throw new CorruptObjectException(oid, "cannot inflate", e);
        }
        return codec.decode(oid, content, kind);
    }

    public Commit loadCommit(String oid) throws IOException {
        return load(oid, Commit.class);
    }

    public Tree loadTree(String oid) throws IOException {
        return load(oid, Tree.class);
    }

    public Blob loadBlob(String oid) throws IOException {
        return load(oid, Blob.class);
    }

    /**
     * 判断给定 oid 的对象文件是否存在。
     */
    public boolean exists(String oid) {
        return HexUtils.isHash(oid, codec.getHashLength())
                && Files.exists(objectsDir.resolve(oid.substring(0, 2)).resolve(oid));
    }

    /** 对象目录。 */
    public Path getObjectsDir() {
        return objectsDir;
    }

    /**
     * 根据 oid 得到 objects/xx/xxyy... 路径（前 2 字符为子目录）。
     * 非法 oid 视为对象不存在。
     */
    Path objectPath(String oid) throws NotFoundException {
        if (!HexUtils.isHash(oid, codec.getHashLength())) {
            throw new NotFoundException("object not found, invalid oid: " + oid);
        }
        return objectsDir.resolve(oid.substring(0, 2)).resolve(oid);
    }

    /**
     * 使用 zlib deflate 压缩输入字节。
     */
    private static byte[] deflate(byte[] input) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (DeflaterOutputStream def = new DeflaterOutputStream(out)) {
            def.write(input);
        }
        return out.toByteArray();
    }

    /**
     * 使用 zlib inflate 解压输入字节。
     */
    private static byte[] inflate(byte[] input) throws IOException {
        try (InflaterInputStream inf = new InflaterInputStream(new ByteArrayInputStream(input));
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            byte[] buf = new byte[8192];
            int n;
            while ((n = inf.read(buf)) != -1) out.write(buf, 0, n);
            return out.toByteArray();
        }
    }
}
