package tuftrust.changelist;

import tuftrust.model.KeyAlgorithm;
import tuftrust.model.TufPublicKey;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic binary encoding of change content: big-endian, every string
 * and list length-prefixed. Changes built locally and changes rebuilt from a
 * remote snapshot carry the same bytes, so they decode identically.
 */
public final class ChangeCodec {

    private ChangeCodec() {}

    public static byte[] encode(TargetMeta meta) {
        return write(out -> {
            out.writeLong(meta.length());
            out.writeInt(meta.hashes().size());
            for (Map.Entry<String, String> e : meta.hashes().entrySet()) {
                writeString(out, e.getKey());
                writeString(out, e.getValue());
            }
        });
    }

    public static TargetMeta decodeTargetMeta(byte[] content) {
        return read(content, in -> {
            long length = in.readLong();
            int n = readCount(in);
            Map<String, String> hashes = new TreeMap<>();
            for (int i = 0; i < n; i++) {
                hashes.put(readString(in), readString(in));
            }
            return new TargetMeta(length, hashes);
        });
    }

    public static byte[] encode(DelegationEdit edit) {
        return write(out -> {
            out.writeInt(edit.threshold());
            writeKeys(out, edit.addKeys());
            writeStrings(out, edit.removeKeys());
            writeStrings(out, edit.addPaths());
            writeStrings(out, edit.removePaths());
            out.writeBoolean(edit.clearAllPaths());
        });
    }

    public static DelegationEdit decodeDelegationEdit(byte[] content) {
        return read(content, in -> new DelegationEdit(
                in.readInt(),
                readKeys(in),
                readStrings(in),
                readStrings(in),
                readStrings(in),
                in.readBoolean()));
    }

    public static byte[] encode(RoleEdit edit) {
        return write(out -> {
            writeKeys(out, edit.keys());
            out.writeInt(edit.threshold());
            out.writeBoolean(edit.serverManaged());
        });
    }

    public static RoleEdit decodeRoleEdit(byte[] content) {
        return read(content, in -> new RoleEdit(readKeys(in), in.readInt(), in.readBoolean()));
    }

    private static void writeKeys(DataOutputStream out, List<TufPublicKey> keys) throws IOException {
        out.writeInt(keys.size());
        for (TufPublicKey k : keys) {
            writeString(out, k.algorithm().tag());
            writeBytes(out, k.encoded());
        }
    }

    private static List<TufPublicKey> readKeys(DataInputStream in) throws IOException {
        int n = readCount(in);
        List<TufPublicKey> keys = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            KeyAlgorithm algorithm = KeyAlgorithm.fromTag(readString(in));
            keys.add(new TufPublicKey(algorithm, readBytes(in)));
        }
        return keys;
    }

    private static void writeStrings(DataOutputStream out, List<String> values) throws IOException {
        out.writeInt(values.size());
        for (String v : values) {
            writeString(out, v);
        }
    }

    private static List<String> readStrings(DataInputStream in) throws IOException {
        int n = readCount(in);
        List<String> values = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            values.add(readString(in));
        }
        return values;
    }

    private static void writeString(DataOutputStream out, String value) throws IOException {
        writeBytes(out, value.getBytes(StandardCharsets.UTF_8));
    }

    private static String readString(DataInputStream in) throws IOException {
        return new String(readBytes(in), StandardCharsets.UTF_8);
    }

    private static void writeBytes(DataOutputStream out, byte[] value) throws IOException {
        out.writeInt(value.length);
        out.write(value);
    }

    private static byte[] readBytes(DataInputStream in) throws IOException {
        byte[] value = new byte[readCount(in)];
        in.readFully(value);
        return value;
    }

    /** A length or element count; each counted item takes at least one byte, so it cannot exceed what is left. */
    private static int readCount(DataInputStream in) throws IOException {
        int n = in.readInt();
        if (n < 0 || n > in.available()) {
            throw new IOException("Bad length " + n + " with " + in.available() + " bytes left");
        }
        return n;
    }

    private static byte[] write(Writer writer) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            writer.write(out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    private static <T> T read(byte[] content, Reader<T> reader) {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(content))) {
            T value = reader.read(in);
            if (in.available() > 0) {
                throw new IllegalArgumentException("Trailing bytes in change content");
            }
            return value;
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed change content", e);
        }
    }

    @FunctionalInterface
    private interface Writer {
        void write(DataOutputStream out) throws IOException;
    }

    @FunctionalInterface
    private interface Reader<T> {
        T read(DataInputStream in) throws IOException;
    }
}
