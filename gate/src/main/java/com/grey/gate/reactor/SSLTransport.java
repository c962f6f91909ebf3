/*
 * Copyright 2012-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.reactor;

import javax.net.ssl.SSLEngineResult;

import com.grey.gate.base.config.SysProps;
import com.grey.gate.reactor.config.SSLConfig;

/**
 * Server-side TLS over a non-blocking socket, driven by an SSLEngine.
 * <br>
 * The handshake is advanced inline by whichever read or flush call finds it waiting, and delegated engine tasks
 * are run on the calling thread. Application data written before the handshake completes is held back and sent
 * once it does.
 */
public class SSLTransport
	implements StreamTransport
{
	private static final int BUFSIZ_SSL = SysProps.get("greygate.ssl.bufsiz_ssl", 0);
	private static final int BUFSIZ_APP = SysProps.get("greygate.ssl.bufsiz_app", 0);
	private static final java.nio.ByteBuffer dummyShakeBuf = java.nio.ByteBuffer.allocate(0); //for handshake wraps, where source is ignored

	private final java.nio.channels.SocketChannel chan;
	private final javax.net.ssl.SSLEngine engine;
	private final XmitQueue xmtq = new XmitQueue(); //encoded SSL records awaiting the socket
	private final java.util.ArrayDeque<java.nio.ByteBuffer> pendingApp = new java.util.ArrayDeque<>(); //held until handshake completes
	private final java.nio.ByteBuffer sslprotoRcvBuf;
	private final java.nio.ByteBuffer sslprotoXmtBuf;
	private final java.nio.ByteBuffer appdataRcvBuf;
	private boolean handshakeDone;
	private boolean closing;

	public boolean isHandshakeComplete() {return handshakeDone;}
	public javax.net.ssl.SSLSession getSession() {return engine.getSession();}

	public SSLTransport(java.nio.channels.SocketChannel chan, SSLConfig sslcfg) throws java.io.IOException
	{
		this.chan = chan;
		engine = sslcfg.getContext().createSSLEngine();
		engine.setUseClientMode(false); //must call this in both modes - even if getUseClientMode() already seems correct
		int clientAuth = sslcfg.getClientAuth();
		if (clientAuth == 1) {
			engine.setWantClientAuth(true);
		} else if (clientAuth == 2) {
			engine.setNeedClientAuth(true);
		}
		javax.net.ssl.SSLSession sess = engine.getSession();
		int netbufsiz = (BUFSIZ_SSL == 0 ? sess.getPacketBufferSize() : BUFSIZ_SSL);
		int appbufsiz = (BUFSIZ_APP == 0 ? sess.getApplicationBufferSize() : BUFSIZ_APP);
		sslprotoRcvBuf = java.nio.ByteBuffer.allocate(netbufsiz);
		sslprotoXmtBuf = java.nio.ByteBuffer.allocate(netbufsiz);
		appdataRcvBuf = java.nio.ByteBuffer.allocate(appbufsiz);
		engine.beginHandshake();
	}

	@Override
	public int read(java.nio.ByteBuffer dst) throws java.io.IOException
	{
		if (appdataRcvBuf.position() == 0) {
			// no decoded data left over from a previous call, so pull in more from the socket
			int nbytes = chan.read(sslprotoRcvBuf);
			if (nbytes == -1) return -1;
			if (sslprotoRcvBuf.position() != 0) decode();
			if (appdataRcvBuf.position() == 0) {
				return (engine.isInboundDone() ? -1 : 0);
			}
		}
		appdataRcvBuf.flip();
		int nbytes = Math.min(appdataRcvBuf.remaining(), dst.remaining());
		int lmt = appdataRcvBuf.limit();
		appdataRcvBuf.limit(appdataRcvBuf.position() + nbytes);
		dst.put(appdataRcvBuf);
		appdataRcvBuf.limit(lmt);
		appdataRcvBuf.compact();
		return nbytes;
	}

	@Override
	public void write(java.nio.ByteBuffer src) throws java.io.IOException
	{
		if (closing) {
			src.position(src.limit());
			return;
		}
		if (!handshakeDone) {
			//even though we can receive app data during a handshake, we can't send any
			java.nio.ByteBuffer buf = java.nio.ByteBuffer.allocate(src.remaining());
			buf.put(src);
			buf.flip();
			pendingApp.add(buf);
			return;
		}
		SSLEngineResult res = encode(src);
		if (res.getStatus() == SSLEngineResult.Status.CLOSED) {
			throw new javax.net.ssl.SSLException("SSL engine closed on transmit to "+chan);
		}
		handshake(res.getHandshakeStatus());
	}

	@Override
	public boolean flush() throws java.io.IOException
	{
		return xmtq.drain(chan);
	}

	@Override
	public boolean isIdle() {return !xmtq.isBlocked() && pendingApp.isEmpty();}

	@Override
	public boolean isSecure() {return true;}

	@Override
	public java.nio.channels.SocketChannel getChannel() {return chan;}

	// send our close_notify, but no need to wait for incoming one
	@Override
	public void close() throws java.io.IOException
	{
		if (closing) return;
		closing = true;
		pendingApp.clear();
		if (!engine.isOutboundDone()) {
			engine.closeOutbound();
			encode(dummyShakeBuf);
			xmtq.drain(chan);
		}
		xmtq.clear();
	}

	private void decode() throws java.io.IOException
	{
		sslprotoRcvBuf.flip();
		try {
			while (sslprotoRcvBuf.hasRemaining()) {
				int pos = appdataRcvBuf.position();
				SSLEngineResult res = engine.unwrap(sslprotoRcvBuf, appdataRcvBuf);
				SSLEngineResult.Status status = res.getStatus();
				if (status == SSLEngineResult.Status.BUFFER_OVERFLOW) {
					if (pos == 0) {
						throw new javax.net.ssl.SSLException("SSL OVERFLOW: appdata="+appdataRcvBuf+", sslproto="+sslprotoRcvBuf
								+" - recommended="+engine.getSession().getApplicationBufferSize());
					}
					break; //caller has to drain appdataRcvBuf before we can unwrap into it
				}
				if (status == SSLEngineResult.Status.BUFFER_UNDERFLOW || status == SSLEngineResult.Status.CLOSED) break;
				handshake(res.getHandshakeStatus());
				if (res.bytesConsumed() == 0 && res.bytesProduced() == 0) break;
			}
		} finally {
			sslprotoRcvBuf.compact();
		}
	}

	// Loops until the handshake needs more input from the peer, or is not in progress
	private void handshake(SSLEngineResult.HandshakeStatus shakeStatus) throws java.io.IOException
	{
		for (;;) {
			switch (shakeStatus)
			{
			case NEED_TASK:
				Runnable task;
				while ((task = engine.getDelegatedTask()) != null) {
					task.run();
				}
				shakeStatus = engine.getHandshakeStatus();
				break;
			case NEED_WRAP:
				shakeStatus = encode(dummyShakeBuf).getHandshakeStatus();
				break;
			case FINISHED:
				handshakeCompleted();
				return;
			case NOT_HANDSHAKING:
				if (!handshakeDone && !closing) handshakeCompleted();
				return;
			default:
				return; //need to wait for more data from the peer
			}
		}
	}

	private void handshakeCompleted() throws java.io.IOException
	{
		handshakeDone = true;
		while (!pendingApp.isEmpty()) {
			write(pendingApp.remove());
		}
	}

	// Loop, in case the source is too large to stuff into sslprotoXmtBuf in one go
	private SSLEngineResult encode(java.nio.ByteBuffer src) throws java.io.IOException
	{
		SSLEngineResult res;
		do {
			sslprotoXmtBuf.clear();
			res = engine.wrap(src, sslprotoXmtBuf);
			sslprotoXmtBuf.flip();
			if (sslprotoXmtBuf.hasRemaining()) xmtq.write(chan, sslprotoXmtBuf);
			if (res.getStatus() == SSLEngineResult.Status.BUFFER_OVERFLOW) {
				throw new javax.net.ssl.SSLException("SSL OVERFLOW on transmit: sslproto="+sslprotoXmtBuf
						+" - recommended="+engine.getSession().getPacketBufferSize());
			}
		} while (res.getStatus() == SSLEngineResult.Status.OK && src.hasRemaining());
		return res;
	}
}
