package org.metricshub.plcflow.util;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * PLC Flow
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 - 2026 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.metricshub.plcflow.frontend.Dialect;
import org.metricshub.plcflow.limits.ResourceLimits;

public class ParserSettingsTest {

	@Test
	public void testDefaults() {
		ParserSettings settings = new ParserSettings();
		assertSame(ResourceLimits.balanced(), settings.getLimits());
		assertFalse(settings.isPermissive());
		assertEquals(Dialect.IEC_61131_3, settings.getDialect());
	}

	@Test
	public void testCopy() {
		ParserSettings settings = new ParserSettings();
		settings.setLimits(ResourceLimits.strict());
		settings.setPermissive(true);
		settings.setDialect(Dialect.VENDOR);

		ParserSettings copy = new ParserSettings(settings);
		settings.setPermissive(false);
		settings.setLimits(ResourceLimits.relaxed());

		assertTrue(copy.isPermissive());
		assertSame(ResourceLimits.strict(), copy.getLimits());
		assertEquals(Dialect.VENDOR, copy.getDialect());
	}

	@Test
	public void testRequiredValues() {
		ParserSettings settings = new ParserSettings();
		assertThrows(IllegalArgumentException.class, () -> settings.setLimits(null));
		assertThrows(IllegalArgumentException.class, () -> settings.setDialect(null));
	}

	@Test
	public void testDescription() {
		ParserSettings settings = new ParserSettings();
		settings.setDialect(Dialect.VENDOR);
		String description = settings.toDescriptionString();
		assertTrue(description, description.startsWith("limits = balanced [maxInputSize=104857600, maxDepth=256"));
		assertTrue(description, description.contains("permissive = false\n"));
		assertTrue(description, description.endsWith("dialect = VENDOR\n"));
	}
}
