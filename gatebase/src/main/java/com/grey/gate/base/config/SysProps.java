/*
 * Copyright 2010-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.base.config;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.grey.gate.base.utils.StringOps;
import com.grey.gate.base.utils.TimeOps;

/**
 * Access to system properties and environment variables.
 * <br>
 * A property named a.b.c can also be supplied as the environment variable A_B_C, which takes precedence.
 * Properties can also be preloaded from a greygate.properties file (see loadGateProps()).
 */
public class SysProps
{
	private static final Map<String,String> AppEnv = new ConcurrentHashMap<>(); //primarily intended for the benefit of tests

	public static final String NULLMARKER = "-";  // placeholder value that translates to null - prevents us traversing a chain of defaults
	public static final String EOL = System.getProperty("line.separator", "\n");
	public static final String DirSep = System.getProperty("file.separator", "/");

	public static final String SYSPROP_PROPSFILE = "greygate.properties";
	public static final String SYSPROP_DIRPATH_TMP = "greygate.paths.tmp";
	public static final String DIRTOKEN_TMP = "%DIRTMP%";
	public static final String TMPDIR = getTempDir();

	public static final boolean isWindows = System.getProperty("os.name", "").startsWith("Windows");

	static {
		loadGateProps();
	}

	public static String get(String name)
	{
		return get(name, null);
	}

	public static String get(String name, String dflt)
	{
		String envName = name.replace('.', '_').toUpperCase();
		String val = AppEnv.get(envName);
		if (val == null || val.isEmpty()) val = System.getenv(envName);
		if (val == null || val.isEmpty()) val = System.getProperty(name);
		if (val == null || val.isEmpty()) val = dflt;
		if (val == null || val.isEmpty() || NULLMARKER.equals(val)) val = null;
		return val;
	}

	public static boolean get(String name, boolean dflt)
	{
		return StringOps.stringAsBool(get(name, StringOps.boolAsString(dflt)));
	}

	public static int get(String name, int dflt)
	{
		return Integer.parseInt(get(name, Integer.toString(dflt)));
	}

	public static long getTime(String name, long dflt)
	{
		String val = get(name, Long.toString(dflt));
		return TimeOps.parseMilliTime(val);
	}

	public static long getTime(String name, String dflt)
	{
		long msecs = TimeOps.parseMilliTime(dflt);
		return getTime(name, msecs);
	}

	public static String set(String name, String newval)
	{
		java.util.Properties props = System.getProperties();
		String oldval = (newval == null || newval.isEmpty() ? (String)props.remove(name) : (String)props.setProperty(name, newval));
		if (oldval != null && oldval.isEmpty()) oldval = null;
		return oldval;
	}

	public static boolean set(String name, boolean val)
	{
		String oldval = set(name, StringOps.boolAsString(val));
		return StringOps.stringAsBool(oldval);
	}

	public static int set(String name, int val)
	{
		String oldval = set(name, Integer.toString(val));
		return (oldval == null ? 0 : Integer.parseInt(oldval));
	}

	public static long setTime(String name, long val)
	{
		String oldval = set(name, Long.toString(val));
		return (oldval == null ? 0L : TimeOps.parseMilliTime(oldval));
	}

	public static void setAppEnv(String name, String val) {
		name = name.toUpperCase();
		if (val == null || val.isEmpty()) {
			AppEnv.remove(name);
		} else {
			AppEnv.put(name, val);
		}
	}

	public static void clearAppEnv() {
		AppEnv.clear();
	}

	public static Map<String,String> getAppEnv() {
		return Collections.unmodifiableMap(AppEnv);
	}

	public static java.util.Properties load(String pthnam) throws java.io.IOException
	{
		java.io.File fh = new java.io.File(pthnam);
		if (!fh.exists()) return null;
		java.util.Properties props = new java.util.Properties();
		try (java.io.FileInputStream strm = new java.io.FileInputStream(fh)) {
			props.load(strm);
		}
		return props;
	}

	private static void loadGateProps()
	{
		String pthnam = get(SYSPROP_PROPSFILE);
		if (pthnam == null) {
			String[] huntpath = new String[]{"./greygate.properties", "./conf/greygate.properties",
					System.getProperty("user.home", ".")+"/greygate.properties"};
			for (int idx = 0; idx != huntpath.length; idx++) {
				java.io.File fh = new java.io.File(huntpath[idx]);
				if (fh.exists()) {
					pthnam = fh.getAbsolutePath();
					break;
				}
			}
		}
		if (pthnam == null) return;
		java.util.Properties props;
		try {
			props = load(pthnam);
		} catch (Exception ex) {
			throw new RuntimeException("Failed to load GreyGate properties from "+pthnam, ex);
		}
		if (props != null) System.getProperties().putAll(props);
	}

	private static String getTempDir()
	{
		String dflt = System.getProperty("java.io.tmpdir", System.getProperty("user.home", "/")+"/tmp");
		return System.getProperty(SYSPROP_DIRPATH_TMP, dflt);
	}
}
