/**
 * Transport seam for peer connections.
 *
 * <p>{@link com.questrail.rpc.transport.PeerDialer} and
 * {@link com.questrail.rpc.transport.PeerTransport} are the only transport
 * types the client lifecycle sees. The Netty implementation lives in
 * {@code transport.netty}. Apart from the TLS {@code SslContext} handed to
 * {@code RpcClientRuntime}, Netty types MUST NOT escape that package.</p>
 */
package com.questrail.rpc.transport;
