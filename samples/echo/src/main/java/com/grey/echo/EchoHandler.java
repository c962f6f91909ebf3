/*
 * Copyright 2012-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.echo;

import org.slf4j.LoggerFactory;

import com.grey.gate.reactor.Dispatcher;
import com.grey.gate.server.ConnectionHandler;
import com.grey.gate.server.GateServer;

/**
 * Greets each client and then echoes back whatever it sends. The connection is closed once the client sends
 * the quit command on a line of its own.
 */
public class EchoHandler
	extends ConnectionHandler
{
	private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(EchoHandler.class);

	private final EchoFactory factory;
	private final StringBuilder linebuf = new StringBuilder();
	private boolean started;

	EchoHandler(java.nio.channels.SocketChannel sock, GateServer srvr, Dispatcher d, EchoFactory f) throws java.io.IOException
	{
		super(sock, srvr, d);
		factory = f;
	}

	@Override
	public void handle() throws java.io.IOException
	{
		Logger.debug("Connected - {}", this);
		started = true;
		factory.sessionStarted();
		transmit(factory.getGreeting()+EOL);
	}

	@Override
	protected void ioReceived(java.nio.ByteBuffer data) throws java.io.IOException
	{
		int pos = data.position();
		transmit(data);
		for (int idx = pos; idx != data.limit(); idx++) {
			char ch = (char)(data.get(idx) & 0xFF);
			if (ch == '\n') {
				if (linebuf.toString().trim().equalsIgnoreCase(factory.getQuitCommand())) {
					closeWhenDone();
					return;
				}
				linebuf.setLength(0);
			} else if (linebuf.length() < 256) {
				linebuf.append(ch);
			}
		}
	}

	@Override
	protected void handleClose()
	{
		Logger.debug("Disconnected - {}", this);
		if (started) factory.sessionEnded();
	}
}
