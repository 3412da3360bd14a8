package com.weixiao.caf.repo;

import com.weixiao.caf.errors.CorruptObjectException;
import com.weixiao.caf.obj.Blob;
import com.weixiao.caf.obj.CafObject;
import com.weixiao.caf.obj.Commit;
import com.weixiao.caf.obj.Tree;
import com.weixiao.caf.utils.HexUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * 对象编解码与 hash：content = "type size\0body"，oid = SHA1(content) 的小写 hex。
 * 对同一对象编码是确定的，解码是无损的。
 */
public final class ObjectCodec {

    private final int hashLength;

    public ObjectCodec(int hashLength) {
        this.hashLength = hashLength;
    }

    /** oid 的 hex 长度。 */
    public int getHashLength() {
        return hashLength;
    }

    /** 编码为 "type size\0body"。 */
    public byte[] encode(CafObject object) {
        byte[] body = object.toBytes();
        byte[] headerBytes = header(object.getType(), body.length);
        byte[] content = new byte[headerBytes.length + body.length];
        System.arraycopy(headerBytes, 0, content, 0, headerBytes.length);
        System.arraycopy(body, 0, content, headerBytes.length, body.length);
        return content;
    }

    /** 计算对象的 oid（不写入对象库）。 */
    public String hash(CafObject object) {
        return HexUtils.bytesToHex(sha1().digest(encode(object)));
    }

    /**
     * 以流方式计算文件内容作为 blob 的 oid，结果与 hash(new Blob(bytes)) 一致。
     */
    public String hashFile(Path file) throws IOException {
        MessageDigest md = sha1();
        md.update(header(Blob.TYPE, Files.size(file)));
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buf = new byte[8192];
            int n;
            while ((n = in.read(buf)) != -1) md.update(buf, 0, n);
        }
        return HexUtils.bytesToHex(md.digest());
    }

    /**
     * 解码 "type size\0body"，并校验类型与期望一致。
     *
     * @param oid     对象 oid，仅用于错误信息
     * @param content 解压后的完整内容
     * @param kind    期望的对象类型
     * @throws CorruptObjectException header 非法、长度不符、类型不符或对象体无法解析
     */
    public <T extends CafObject> T decode(String oid, byte[] content, Class<T> kind) throws CorruptObjectException {
        int nul = indexOf(content, (byte) 0);
        if (nul < 0) throw new CorruptObjectException(oid, "missing header terminator");
        String typeSize = new String(content, 0, nul, StandardCharsets.UTF_8);
        int space = typeSize.indexOf(' ');
        if (space < 0) throw new CorruptObjectException(oid, "invalid header: " + typeSize);
        String type = typeSize.substring(0, space);
        int declared;
        try {
            declared = Integer.parseInt(typeSize.substring(space + 1));
        } catch (NumberFormatException e) {
            throw new CorruptObjectException(oid, "invalid size in header: " + typeSize, e);
        }
        byte[] body = new byte[content.length - nul - 1];
        System.arraycopy(content, nul + 1, body, 0, body.length);
        if (declared != body.length) {
            throw new CorruptObjectException(oid, "size mismatch: header=" + declared + " actual=" + body.length);
        }

        CafObject object;
        try {
            switch (type) {
                case Blob.TYPE:
                    object = new Blob(body);
                    break;
                case Tree.TYPE:
                    object = Tree.parse(body, hashLength);
                    break;
                case Commit.TYPE:
                    object = Commit.parse(body);
                    break;
                default:
                    throw new CorruptObjectException(oid, "unknown type: " + type);
            }
        } catch (CorruptObjectException e) {
            throw e;
        } catch (IOException e) {
            throw new CorruptObjectException(oid, e.getMessage(), e);
        }
        if (!kind.isInstance(object)) {
            throw new CorruptObjectException(oid, "expected " + kind.getSimpleName().toLowerCase() + ", got " + type);
        }
        return kind.cast(object);
    }

    private static byte[] header(String type, long size) {
        return (type + " " + size + "\0").getBytes(StandardCharsets.UTF_8);
    }

    private static MessageDigest sha1() {
        try {
            return MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * 在字节数组中查找第一个等于 b 的下标，未找到返回 -1。
     */
    private static int indexOf(byte[] a, byte b) {
        for (int i = 0; i < a.length; i++) if (a[i] == b) return i;
        return -1;
    }
}
