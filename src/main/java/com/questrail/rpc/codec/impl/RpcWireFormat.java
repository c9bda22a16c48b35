package com.questrail.rpc.codec.impl;

import com.questrail.rpc.codec.RpcDecodeException;
import com.questrail.rpc.codec.RpcFrame;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Constants and primitive field helpers shared by the frame encoder and decoder.
 */
final class RpcWireFormat
{
    static final int VERSION = 1;

    static final int KIND_CALL = 0x01;
    static final int KIND_REPLY = 0x02;
    static final int KIND_FAILURE = 0x03;

    /** version + kind + callId */
    static final int HEADER_LENGTH = 1 + 1 + Long.BYTES;

    static final int MAX_FRAME_LENGTH = RpcFrame.MAX_FRAME_LENGTH;

    static final int MAX_STRING_LENGTH = 0xFFFF;

    private RpcWireFormat() {}

    static byte[] utf8(String value)
    {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > MAX_STRING_LENGTH) {
            throw new IllegalArgumentException("string field too long: " + bytes.length + " bytes");
        }
        return bytes;
    }

    static void putString(ByteBuffer out, byte[] utf8)
    {
        out.putShort((short) utf8.length);
        out.put(utf8);
    }

    static String getString(ByteBuffer in)
    {
        try {
            int length = in.getShort() & 0xFFFF;
            if (length > in.remaining()) {
                throw new RpcDecodeException("string length " + length + " exceeds remaining " + in.remaining());
            }
            ByteBuffer slice = in.slice();
            slice.limit(length);
            in.position(in.position() + length);

            CharBuffer chars = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(slice);
            return chars.toString();
        } catch (BufferUnderflowException e) {
            throw new RpcDecodeException("truncated string field", e);
        } catch (CharacterCodingException e) {
            throw new RpcDecodeException("malformed UTF-8 in string field", e);
        }
    }
}
