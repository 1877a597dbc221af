package com.davfx.wind.util;

import org.assertj.core.api.Assertions;
import org.junit.Test;

import com.davfx.wind.util.sample.Sample;
import com.davfx.wind.util.sample.dependencies.Dependencies;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

public final class ConfigUtilsTest {
	
	@Test
	public void testResource() throws Exception {
		Config c = ConfigUtils.load(new Dependencies(), "test");
		Assertions.assertThat(c.getString("a.b")).isEqualTo("bb");
		Assertions.assertThat(ConfigUtils.getDuration(c, "a.c")).isEqualTo(3d);
	}
	
	@Test
	public void testResourceOverridesModule() throws Exception {
		Config c = ConfigUtils.load(new Dependencies(), "test").getConfig("com.davfx.wind.util.sample");
		Assertions.assertThat(c.getString("kept")).isEqualTo("sample");
		Assertions.assertThat(c.getString("overridden")).isEqualTo("test");
	}
	
	@Test
	public void testPackageConfig() throws Exception {
		Config c = ConfigUtils.load(new Dependencies(), Sample.class);
		Assertions.assertThat(c.getString("overridden")).isEqualTo("sample");
	}
	
	@Test(expected = ConfigException.class)
	public void testMissingResource() throws Exception {
		ConfigUtils.load(new Dependencies(), "missing");
	}
}
