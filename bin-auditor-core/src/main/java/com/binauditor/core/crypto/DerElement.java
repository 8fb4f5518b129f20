package com.binauditor.core.crypto;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * One DER tag-length-value element over a shared byte array.
 *
 * <p>Only definite lengths and single-byte tags are accepted, which covers every structure
 * that appears in code-signing blobs. Elements nest at most {@value #MAX_DEPTH} levels below
 * the element that was parsed first.
 */
public final class DerElement {

    public static final int INTEGER = 0x02;
    public static final int OCTET_STRING = 0x04;
    public static final int NULL = 0x05;
    public static final int OBJECT_IDENTIFIER = 0x06;
    public static final int SEQUENCE = 0x30;
    public static final int SET = 0x31;
    public static final int CONTEXT_0 = 0xA0;
    public static final int CONTEXT_1 = 0xA1;

    public static final int MAX_DEPTH = 32;

    private final byte[] data;
    private final int start;
    private final int tag;
    private final int contentOffset;
    private final int contentLength;
    private final int depth;

    private DerElement(byte[] data, int start, int tag, int contentOffset, int contentLength, int depth) {
        this.data = data;
        this.start = start;
        this.tag = tag;
        this.contentOffset = contentOffset;
        this.contentLength = contentLength;
        this.depth = depth;
    }

    /**
     * Parses the element starting at {@code offset}. Bytes after the element are ignored.
     */
    public static DerElement parse(byte[] data, int offset, int limit) throws CmsException {
        return parse(data, offset, limit, 0);
    }

    private static DerElement parse(byte[] data, int offset, int limit, int depth) throws CmsException {
        if (offset < 0 || (long) offset + 2 > limit || limit > data.length) {
            throw new CmsException("DER element truncated at offset " + offset);
        }
        int tag = data[offset] & 0xFF;
        if ((tag & 0x1F) == 0x1F) {
            throw new CmsException("Multi-byte DER tags are not supported");
        }
        int lengthByte = data[offset + 1] & 0xFF;
        int cursor = offset + 2;
        long length;
        if (lengthByte < 0x80) {
            length = lengthByte;
        } else if (lengthByte == 0x80) {
            throw new CmsException("Indefinite-length encoding is not DER");
        } else {
            int count = lengthByte & 0x7F;
            if (count > 4 || (long) cursor + count > limit) {
                throw new CmsException("Invalid DER length at offset " + offset);
            }
            length = 0;
            for (int i = 0; i < count; i++) {
                length = (length << 8) | (data[cursor++] & 0xFF);
            }
        }
        if (length > (long) limit - cursor) {
            throw new CmsException("DER element at offset " + offset + " overruns its container");
        }
        return new DerElement(data, offset, tag, cursor, (int) length, depth);
    }

    public static DerElement parse(byte[] data) throws CmsException {
        return parse(data, 0, data.length);
    }

    /**
     * Parses a run of consecutive elements filling {@code data}.
     */
    public static List<DerElement> parseAll(byte[] data) throws CmsException {
        List<DerElement> elements = new ArrayList<>();
        int cursor = 0;
        while (cursor < data.length) {
            DerElement element = parse(data, cursor, data.length);
            elements.add(element);
            cursor = element.end();
        }
        return elements;
    }

    public int tag() {
        return tag;
    }

    public boolean isConstructed() {
        return (tag & 0x20) != 0;
    }

    public byte[] content() {
        return Arrays.copyOfRange(data, contentOffset, contentOffset + contentLength);
    }

    public byte[] encoded() {
        return Arrays.copyOfRange(data, start, end());
    }

    public int end() {
        return contentOffset + contentLength;
    }

    public int depth() {
        return depth;
    }

    public List<DerElement> children() throws CmsException {
        if (!isConstructed()) {
            throw new CmsException("DER tag 0x" + Integer.toHexString(tag) + " is primitive");
        }
        if (depth >= MAX_DEPTH) {
            throw new CmsException("DER nesting exceeds " + MAX_DEPTH + " levels at offset " + start);
        }
        List<DerElement> children = new ArrayList<>();
        int cursor = contentOffset;
        int limit = end();
        while (cursor < limit) {
            DerElement child = parse(data, cursor, limit, depth + 1);
            children.add(child);
            cursor = child.end();
        }
        return children;
    }

    /**
     * Returns the single child of a constructed element, typically an explicit tag wrapper.
     */
    public DerElement firstChild() throws CmsException {
        List<DerElement> children = children();
        if (children.isEmpty()) {
            throw new CmsException("DER tag 0x" + Integer.toHexString(tag) + " is empty");
        }
        return children.get(0);
    }

    public DerElement expect(int expectedTag) throws CmsException {
        if (tag != expectedTag) {
            throw new CmsException("Expected DER tag 0x" + Integer.toHexString(expectedTag)
                + " but found 0x" + Integer.toHexString(tag));
        }
        return this;
    }

    public BigInteger asInteger() throws CmsException {
        expect(INTEGER);
        if (contentLength == 0) {
            throw new CmsException("Empty DER integer");
        }
        return new BigInteger(content());
    }

    public String asOid() throws CmsException {
        expect(OBJECT_IDENTIFIER);
        byte[] bytes = content();
        if (bytes.length == 0) {
            throw new CmsException("Empty object identifier");
        }
        StringBuilder oid = new StringBuilder();
        long value = 0;
        boolean first = true;
        for (byte b : bytes) {
            if (value > (Long.MAX_VALUE >>> 7)) {
                throw new CmsException("Object identifier arc is too large");
            }
            value = (value << 7) | (b & 0x7F);
            if ((b & 0x80) == 0) {
                if (first) {
                    int arc = (int) Math.min(value / 40, 2);
                    oid.append(arc).append('.').append(value - arc * 40L);
                    first = false;
                } else {
                    oid.append('.').append(value);
                }
                value = 0;
            }
        }
        if ((bytes[bytes.length - 1] & 0x80) != 0) {
            throw new CmsException("Object identifier ends inside an arc");
        }
        return oid.toString();
    }
}
