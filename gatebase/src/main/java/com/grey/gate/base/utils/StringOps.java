/*
 * Copyright 2010-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.base.utils;

public class StringOps
{
	public static boolean stringAsBool(String strval)
	{
		if (strval == null) return false;
		return (strval.equalsIgnoreCase("YES") || strval.equalsIgnoreCase("Y")
				|| strval.equalsIgnoreCase("TRUE") || strval.equalsIgnoreCase("T")
				|| strval.equalsIgnoreCase("ON")
				|| strval.equals("1"));
	}

	public static String boolAsString(boolean bval)
	{
		return (bval ? "Y" : "N");
	}

	// zero-pad numbers without generating any memory garbage
	public static StringBuilder zeroPad(StringBuilder sbuf, int numval, int size)
	{
		int pad = size - digits(numval);
		for (int loop = 0; loop < pad; loop++) sbuf.append('0');
		sbuf.append(numval);
		return sbuf;
	}

	// How many digits are required to represent a decimal number?
	public static int digits(int numval)
	{
		if (numval < 10) return 1;
		if (numval < 100) return 2;
		if (numval < 1000) return 3;
		if (numval < 10000) return 4;
		if (numval < 100000) return 5;
		if (numval < 1000000) return 6;
		if (numval < 10000000) return 7;
		if (numval < 100000000) return 8;
		if (numval < 1000000000) return 9;
		return 10;
	}

	public static long parseDecimal(CharSequence cs, int off, int len)
	{
		if (len == 0) return 0;
		long numval = 0;
		int lmt = off + len;
		for (int idx = off; idx != lmt; idx++) {
			char ch = cs.charAt(idx);
			if (ch < '0' || ch > '9') throw new NumberFormatException("Invalid digit="+ch+" at off="+idx+" - "+cs);
			numval = (numval * 10) + (ch - '0');
		}
		return numval;
	}
}
