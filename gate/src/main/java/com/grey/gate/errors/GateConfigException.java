/*
 * Copyright 2018-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.errors;

/**
 * Raised for invalid settings or option combinations, before any serving starts.
 */
public class GateConfigException extends GateException {
	private static final long serialVersionUID = 1L;

	public GateConfigException(String msg) {
		super(true, msg);
	}

	public GateConfigException(String msg, Throwable cause) {
		super(true, msg, cause);
	}
}
