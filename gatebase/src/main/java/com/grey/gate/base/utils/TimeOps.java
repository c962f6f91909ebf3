/*
 * Copyright 2010-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.base.utils;

import com.grey.gate.base.config.SysProps;

public final class TimeOps
{
	public static final String TZDFLT = SysProps.get("greygate.timezone");  //null means use JVM system default

	public static final long MSECS_PER_SECOND = 1000L;
	public static final long MSECS_PER_MINUTE = 60L * MSECS_PER_SECOND;
	public static final long MSECS_PER_HOUR = 60L * MSECS_PER_MINUTE;
	public static final long MSECS_PER_DAY = 24L * MSECS_PER_HOUR;

	public static StringBuilder makeTimeLogger(long systime, StringBuilder buf, boolean withdate, boolean withmilli)
	{
		java.util.Calendar dtcal = getCalendar(systime, null);
		return makeTimeLogger(dtcal, buf, withdate, withmilli);
	}

	public static StringBuilder makeTimeLogger(java.util.Calendar dtcal, StringBuilder buf, boolean withdate, boolean withmilli)
	{
		if (buf == null) buf = new StringBuilder();
		if (withdate) {
			buf.append(dtcal.get(java.util.Calendar.YEAR)).append('-');  // always 4 digits anyway, so no need for zeropad()
			StringOps.zeroPad(buf, dtcal.get(java.util.Calendar.MONTH) + 1, 2).append('-');
			StringOps.zeroPad(buf, dtcal.get(java.util.Calendar.DAY_OF_MONTH), 2).append(' ');
		}
		StringOps.zeroPad(buf, dtcal.get(java.util.Calendar.HOUR_OF_DAY), 2).append(':');
		StringOps.zeroPad(buf, dtcal.get(java.util.Calendar.MINUTE), 2).append(':');
		StringOps.zeroPad(buf, dtcal.get(java.util.Calendar.SECOND), 2);

		if (withmilli) {
			buf.append('.');
			StringOps.zeroPad(buf, dtcal.get(java.util.Calendar.MILLISECOND), 3);
		}
		return buf;
	}

	/**
	 * Parses a time interval such as "1h30m", "90s" or "250" (a bare number is in milliseconds).
	 * Units must appear in descending order.
	 */
	public static long parseMilliTime(CharSequence str)
	{
		return parseMilliTime(str, 0, str.length());
	}

	public static long parseMilliTime(CharSequence str, int off, int len)
	{
		long msecs = 0;
		int lmt = off + len + 1;
		int off_unit = off; //offset at which current unit begins
		long prevmult = 0;

		for (int idx = off; idx != lmt; idx++) {
			// loop one extra time and simulate a milliseconds designator on the final dummy loop
			char ch = (idx == lmt - 1 ? 0 : str.charAt(idx));
			long mult = 0;

			if (ch == 'd') {
				mult = MSECS_PER_DAY;
			} else if (ch == 'h') {
				mult = MSECS_PER_HOUR;
			} else if (ch == 'm') {
				mult = MSECS_PER_MINUTE;
			} else if (ch == 's') {
				mult = MSECS_PER_SECOND;
			} else if (ch == 0) {
				mult = 1;
			} else {
				if (!Character.isDigit(ch)) {
					throw new NumberFormatException("Invalid char="+ch+" at off="+idx+" - "+str.subSequence(off, off+len));
				}
				continue;
			}

			if (prevmult != 0 && prevmult <= mult) {
				throw new NumberFormatException("Time units in wrong sequence - "+str.subSequence(off, off+len));
			}
			long unit = StringOps.parseDecimal(str, off_unit, idx - off_unit);
			msecs += (unit * mult);
			off_unit = idx + 1;
			prevmult = mult;
		}
		return msecs;
	}

	public static StringBuilder expandMilliTime(long msecs)
	{
		return expandMilliTime(msecs, null, false);
	}

	public static StringBuilder expandMilliTime(long msecs, StringBuilder str, boolean reset)
	{
		if (str == null) {
			str = new StringBuilder();
		} else if (reset) {
			str.setLength(0);
		}
		int origlen = str.length();

		long units = msecs / MSECS_PER_DAY;
		if (units != 0) {
			str.append(units).append('d');
			msecs = msecs % MSECS_PER_DAY;
		}

		units = msecs / MSECS_PER_HOUR;
		if (units != 0) {
			str.append(units).append('h');
			msecs = msecs % MSECS_PER_HOUR;
		}

		units = msecs / MSECS_PER_MINUTE;
		if (units != 0) {
			str.append(units).append('m');
			msecs = msecs % MSECS_PER_MINUTE;
		}

		units = msecs / MSECS_PER_SECOND;
		if (units != 0) {
			str.append(units).append('s');
			msecs = msecs % MSECS_PER_SECOND;
		}

		if (str.length() == origlen || msecs != 0) {
			str.append(msecs);
		}
		return str;
	}

	public static java.util.Calendar getCalendar(long systime, String tz)
	{
		java.util.Calendar cal = getCalendar(tz);
		cal.setTimeInMillis(systime);
		return cal;
	}

	public static java.util.Calendar getCalendar(String tz)
	{
		if (tz == null) tz = TZDFLT;
		if (tz == null) return java.util.Calendar.getInstance();
		return java.util.Calendar.getInstance(java.util.TimeZone.getTimeZone(tz));
	}
}
