/*
 * Copyright 2018-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.errors;

public class GateException extends RuntimeException {
	private static final long serialVersionUID = 1L;
	private final boolean is_error;

	public GateException(boolean error, String msg, Throwable cause) {
		super(msg, cause);
		this.is_error = error;
	}

	public GateException(boolean error, String msg) {
		this(error, msg, null);
	}

	public GateException(String msg) {
		this(msg, null);
	}

	public GateException(String msg, Throwable cause) {
		this(false, msg, cause);
	}

	public boolean error() {
		return is_error;
	}

	@Override
	public String toString() {
		return super.toString()+" - error="+error();
	}

	// Errors are faults in our own code or config, as opposed to routine I/O failures caused by the remote peer
	public static boolean isError(Throwable ex) {
		if (ex instanceof GateException) return ((GateException)ex).error();
		return (ex instanceof Error
				|| ex instanceof RuntimeException);
	}
}
