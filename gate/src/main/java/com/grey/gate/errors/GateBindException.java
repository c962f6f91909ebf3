/*
 * Copyright 2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.errors;

/**
 * Failure to resolve, bind or listen on a server address.
 */
public class GateBindException extends java.io.IOException {
	private static final long serialVersionUID = 1L;
	private final java.net.InetSocketAddress address;

	public GateBindException(String msg, java.net.InetSocketAddress addr) {
		this(msg, addr, null);
	}

	public GateBindException(String msg, java.net.InetSocketAddress addr, Throwable cause) {
		super(msg, cause);
		address = addr;
	}

	public java.net.InetSocketAddress getAddress() {
		return address;
	}
}
