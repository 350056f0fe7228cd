package org.metricshub.plcflow.analysis.symbols;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Names visible in a scope, compared ignoring case. A lookup that fails in
 * a scope goes on in its parent.
 */
public class SymbolTable {

	private final String name;
	private final SymbolTable parent;
	private final Map<String, Symbol> symbols = new LinkedHashMap<String, Symbol>();

	/**
	 * Creates a top-level scope.
	 *
	 * @param name the scope name
	 */
	public SymbolTable(String name) {
		this(name, null);
	}

	/**
	 * @param name the scope name, usually the POU name
	 * @param parent the enclosing scope, {@code null} for a top-level one
	 */
	public SymbolTable(String name, SymbolTable parent) {
		this.name = name;
		this.parent = parent;
	}

	private static String key(String symbolName) {
		return symbolName.toUpperCase(Locale.ROOT);
	}

	public String getName() {
		return name;
	}

	public SymbolTable getParent() {
		return parent;
	}

	/**
	 * Adds a symbol to this scope, unless the name is already defined in it.
	 * Parent scopes are not looked at: a local name may hide an outer one.
	 *
	 * @param symbol the symbol to add
	 * @return {@code null} if added, or the symbol already holding the name
	 */
	public Symbol define(Symbol symbol) {
		String key = key(symbol.getName());
		Symbol existing = symbols.get(key);
		if (existing != null) {
			return existing;
		}
		symbols.put(key, symbol);
		return null;
	}

	/**
	 * @param symbolName name to look for, in this scope then in its parents
	 * @return the symbol, {@code null} if the name is not defined
	 */
	public Symbol lookup(String symbolName) {
		for (SymbolTable scope = this; scope != null; scope = scope.parent) {
			Symbol symbol = scope.symbols.get(key(symbolName));
			if (symbol != null) {
				return symbol;
			}
		}
		return null;
	}

	/**
	 * @param symbolName name to look for in this scope only
	 * @return whether the name is defined here
	 */
	public boolean isDefinedLocally(String symbolName) {
		return symbols.containsKey(key(symbolName));
	}

	/**
	 * Looks a name up and flags it as referenced.
	 *
	 * @param symbolName the referenced name
	 * @return the symbol, {@code null} if the name is not defined
	 */
	public Symbol reference(String symbolName) {
		Symbol symbol = lookup(symbolName);
		if (symbol != null) {
			symbol.markReferenced();
		}
		return symbol;
	}

	/**
	 * @return the symbols of this scope, in definition order
	 */
	public List<Symbol> getSymbols() {
		return Collections.unmodifiableList(new ArrayList<Symbol>(symbols.values()));
	}

	/**
	 * @return the symbols of this scope that should have been referenced and were not
	 */
	public List<Symbol> getUnreferenced() {
		List<Symbol> unreferenced = new ArrayList<Symbol>();
		for (Symbol symbol : symbols.values()) {
			if (symbol.isExpectedToBeReferenced() && !symbol.isReferenced()) {
				unreferenced.add(symbol);
			}
		}
		return unreferenced;
	}

	@Override
	public String toString() {
		return "SymbolTable[" + name + ", " + symbols.size() + " symbols]";
	}
}
