/**
 * Heartbeat Codec
 * =============================================================================
 *
 * <p>Wire encoding of the heartbeat call and its answers. Only the
 * {@code Heartbeat.Ping} request/response shape is defined; arbitrary RPC
 * methods are out of scope.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   length-delimited byte[] (transport adapter)
 *        → RpcFrameDecoder
 *            → RpcFrame (Call | Reply | Failure)
 *                → call correlation in the transport
 * </pre>
 *
 * <h2>Frame body</h2>
 * <pre>
 *   u8  version (1)
 *   u8  kind    (0x01 call, 0x02 reply, 0x03 failure)
 *   i64 callId
 *   call:    str method, i64 offset, i64 error, i64 measuredAt, str addr
 *   reply:   i64 serverTime
 *   failure: str message
 * </pre>
 * <p>Integers are big-endian; {@code str} is a u16 byte length followed by
 * UTF-8 bytes.</p>
 */
package com.questrail.rpc.codec;
