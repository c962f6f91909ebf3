/*
 * Copyright 2010-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.logging;

import com.grey.gate.base.ExceptionUtils;
import com.grey.gate.base.config.SysProps;
import com.grey.gate.base.utils.TimeOps;

/**
 * Base class for a range of loggers offering basic log() interfaces.
 * <br>
 * The subclasses are meant to be accessed via this type, and are created via the Factory methods.
 * <p>
 * This base class is MT-safe with respect to its public methods, but concrete classes need to synchronise access to
 * their log(CharSequence msg) and flush() methods in order to be fully MT-safe (see MTCharLogger).
 */
abstract public class Logger
	implements java.io.Closeable, java.io.Flushable
{
	public enum LEVEL {OFF, ERR, WARN, INFO, TRC, TRC2, TRC3, TRC4, TRC5, ALL}

	private final boolean isMT;
	private final String name;
	private final String this_string;
	private final String pthnam;
	private final java.io.OutputStream strm_base;
	private final boolean withPID;
	private final boolean withTID;
	private final boolean withThreadName;
	private final boolean withInitMark;
	private final long flush_interval;  // interval between logfile flushes, in milliseconds
	protected final int bufsiz;
	private final java.util.Calendar dtcal = TimeOps.getCalendar(null); //merely pre-allocated for efficiency

	private volatile LEVEL maxLevel; //active log level
	private long last_flushtime;
	private boolean isOwner;

	abstract public void log(LEVEL lvl, CharSequence msg);

	// most subclasses would override these
	protected void openStream(java.io.OutputStream strm) throws java.io.IOException {}
	protected void openStream(String pthnam) throws java.io.IOException {}
	protected void closeStream(boolean is_owner) throws java.io.IOException {}
	@Override
	public void flush() throws java.io.IOException {}

	boolean isOwner() {return isOwner;}
	public boolean isActive(LEVEL lvl) {return Interop.isActive(getLevel(), lvl);}
	public String getName() {return name;}
	public String getPathname() {return pthnam;}
	public LEVEL getLevel() {return maxLevel;}
	@Override
	public String toString() {return this_string;}

	protected Logger(Parameters params, String logname, boolean is_mt)
	{
		name = logname;
		isMT = is_mt;
		pthnam = params.getPathname();
		strm_base = params.getStream();
		withPID = params.withPID();
		withTID = (isMT ? true : params.withTID());
		withThreadName = params.withThreadName();
		withInitMark = !params.isQuietMode();
		bufsiz = params.getBufSize();
		flush_interval = params.getFlushInterval();
		maxLevel = params.getLogLevel();

		String desc = (name == null ? "" : "Name="+name+" ");
		desc += params.toString();
		if (isMT) desc += " MT";
		this_string = desc;
	}

	// This has to be called after the constructor, as it calls back up into the subclasses.
	// The Factory methods take care of that, which is why the Logger constructors are protected.
	protected void init() throws java.io.IOException
	{
		open(System.currentTimeMillis());
	}

	public LEVEL setLevel(LEVEL newlvl)
	{
		LEVEL oldlvl = getLevel();
		if (newlvl == oldlvl) return oldlvl;
		maxLevel = newlvl;
		String action = (newlvl.ordinal() < oldlvl.ordinal()) ? "Reduced" : "Increased";
		log(LEVEL.ALL, action+" log level from " + oldlvl + " to " + newlvl);
		return oldlvl;
	}

	synchronized private void open(long systime) throws java.io.IOException
	{
		if (pthnam == null) {
			openStream(strm_base);
		} else {
			java.io.File fh = new java.io.File(pthnam);
			java.io.File dirh = fh.getParentFile();
			if (dirh != null && !dirh.exists() && !dirh.mkdirs()) {
				throw new java.io.IOException("Failed to create logs directory="+dirh.getAbsolutePath());
			}
			openStream(pthnam);
			isOwner = true;
		}
		if (!withInitMark) return;

		java.lang.management.RuntimeMXBean rt = java.lang.management.ManagementFactory.getRuntimeMXBean();
		log(LEVEL.ALL, "INITMARK:"
				+SysProps.EOL+"\t"
				+this
				+SysProps.EOL+"\t"
				+"Opened "+(pthnam==null ? "stream" : pthnam)
				+" with level="+getLevel()+" at "+new java.util.Date(systime)
				+SysProps.EOL+"\t"
				+"Thread="+rt.getName()+":"+Thread.currentThread().getName()+":"+Thread.currentThread().getId()
				+", Running since " + new java.util.Date(rt.getStartTime()));
		flush();
	}

	@Override
	synchronized public void close()
	{
		try {
			flush();
			closeStream(isOwner);
		} catch (Exception ex) {
			System.out.println(new java.util.Date(System.currentTimeMillis())+" Logger failed to close logfile - "+this_string+" - "
					+ExceptionUtils.summary(ex, false));
		}
		isOwner = false;
	}

	public void log(LEVEL lvl, Throwable ex, boolean dumpStack, CharSequence msg)
	{
		if (!isActive(lvl)) return;
		if (ex == null) {log(lvl, msg); return;}
		if (ex instanceof NullPointerException || ex instanceof ArrayIndexOutOfBoundsException) dumpStack = true;
		String conj = (dumpStack ? "\n\t" : " - ");
		String exmsg = "EXCEPTION: "+msg+conj+ExceptionUtils.summary(ex, dumpStack);
		log(lvl, exmsg);
	}

	// Prepare a new logfile entry, by constructing the standard prefix portion of the new message.
	// There is no synchronisation performed in here, and multi-threaded loggers need to ensure that all necessary
	// synchronisation happens at a higher level.
	protected StringBuilder setLogEntry(LEVEL lvl, StringBuilder pfxbuf) throws java.io.IOException
	{
		long systime = System.currentTimeMillis();
		dtcal.setTimeInMillis(systime);

		pfxbuf.setLength(0);
		TimeOps.makeTimeLogger(dtcal, pfxbuf, true, true);
		pfxbuf.append(' ');
		char intro = '[';

		if (lvl != LEVEL.ALL) {
			pfxbuf.append(intro).append(lvl);
			intro = '-';
		}
		if (withPID) {
			pfxbuf.append(intro).append('P').append(Parameters.CURRENT_PID);
			intro = '-';
		}
		if (withTID) {
			pfxbuf.append(intro).append('T').append(Thread.currentThread().getId());
			intro = '-';
		}
		if (withThreadName) {
			String tnam = Thread.currentThread().getName();
			if (tnam != null && tnam.length() != 0) {
				pfxbuf.append(intro).append(tnam);
				intro = '-';
			}
		}
		if (intro != '[') pfxbuf.append("] ");

		if (flush_interval != 0 && systime - last_flushtime >= flush_interval) {
			flush();
			last_flushtime = systime;
		}
		return pfxbuf;
	}

	public void error(CharSequence msg) {log(LEVEL.ERR, msg);}
	public void warn(CharSequence msg) {log(LEVEL.WARN, msg);}
	public void info(CharSequence msg) {log(LEVEL.INFO, msg);}
	public void trace(CharSequence msg) {log(LEVEL.TRC, msg);}
}
