/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.server;

import com.grey.gate.reactor.Dispatcher;

/**
 * Creates the protocol handler for each accepted connection.
 * <br>
 * Factory classes named in the XML config must provide a public constructor taking a
 * {@link com.grey.gate.base.config.XmlConfig} (the factory element) or else a no-arg one.
 */
@FunctionalInterface
public interface HandlerFactory
{
	ConnectionHandler createHandler(java.nio.channels.SocketChannel sock, GateServer server, Dispatcher dsptch) throws java.io.IOException;
}
