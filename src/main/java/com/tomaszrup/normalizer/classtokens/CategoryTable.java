////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.normalizer.classtokens;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Immutable lookup table ranking utility class tokens.
 *
 * <p>Keys are either exact tokens ({@code flex}) or prefixes ending with a
 * dash ({@code bg-}). A token is ranked by exact match first, then by the
 * longest matching prefix. Tokens carrying a variant prefix are ranked in
 * three bands after everything else: breakpoints, interaction states, theme.
 *
 * <p>The table is shared by reference; {@link #VERSION} changes whenever its
 * content does.
 */
public final class CategoryTable {
	public static final String VERSION = "1";

	public static final int UNKNOWN_RANK = 180;
	public static final int BREAKPOINT_RANK = 200;
	public static final int STATE_RANK = 210;
	public static final int THEME_RANK = 220;

	private static final Pattern BREAKPOINT_VARIANT = Pattern.compile("^(sm|md|lg|xl|2xl):");
	private static final Pattern STATE_VARIANT = Pattern.compile(
			"^(hover|focus|focus-visible|focus-within|active|disabled|visited|first|last|odd|even"
					+ "|group-hover|group-focus|peer-hover|peer-focus):");
	private static final Pattern THEME_VARIANT = Pattern.compile("^(dark|light):");

	private static final CategoryTable DEFAULT = new CategoryTable(defaultRanks(), defaultRules());

	/**
	 * Pattern recognizing one family of tokens.
	 */
	public static final class PatternRule {
		private final Pattern pattern;
		private final TokenCategory category;

		PatternRule(String regex, TokenCategory category) {
			this.pattern = Pattern.compile(regex);
			this.category = category;
		}

		public boolean matches(String token) {
			return pattern.matcher(token).find();
		}

		public TokenCategory getCategory() {
			return category;
		}

		@Override
		public String toString() {
			return pattern.pattern() + " -> " + category;
		}
	}

	private final Map<String, Integer> ranks;
	private final List<String> prefixesLongestFirst;
	private final List<PatternRule> rules;

	private CategoryTable(Map<String, Integer> ranks, List<PatternRule> rules) {
		this.ranks = Collections.unmodifiableMap(new LinkedHashMap<>(ranks));
		List<String> prefixes = new ArrayList<>();
		for (String key : ranks.keySet()) {
			if (key.endsWith("-")) {
				prefixes.add(key);
			}
		}
		prefixes.sort((a, b) -> b.length() - a.length());
		this.prefixesLongestFirst = Collections.unmodifiableList(prefixes);
		this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
	}

	public static CategoryTable defaultTable() {
		return DEFAULT;
	}

	public int rankOf(String token) {
		if (BREAKPOINT_VARIANT.matcher(token).find()) {
			return BREAKPOINT_RANK;
		}
		if (STATE_VARIANT.matcher(token).find()) {
			return STATE_RANK;
		}
		if (THEME_VARIANT.matcher(token).find()) {
			return THEME_RANK;
		}
		Integer exact = ranks.get(token);
		if (exact != null) {
			return exact;
		}
		String prefix = longestPrefix(token);
		return prefix != null ? ranks.get(prefix) : UNKNOWN_RANK;
	}

	/**
	 * Category from the first matching pattern rule, else from the rank.
	 */
	public TokenCategory categoryOf(String token) {
		for (PatternRule rule : rules) {
			if (rule.matches(token)) {
				return rule.getCategory();
			}
		}
		return TokenCategory.forRank(rankOf(token));
	}

	/**
	 * Whether a pattern rule or a table entry recognizes {@code token}.
	 */
	public boolean recognizes(String token) {
		for (PatternRule rule : rules) {
			if (rule.matches(token)) {
				return true;
			}
		}
		return ranks.containsKey(token) || longestPrefix(token) != null;
	}

	public Map<String, Integer> getRanks() {
		return ranks;
	}

	public List<PatternRule> getRules() {
		return rules;
	}

	private String longestPrefix(String token) {
		for (String prefix : prefixesLongestFirst) {
			if (token.startsWith(prefix) && token.length() > prefix.length()) {
				return prefix;
			}
		}
		return null;
	}

	private static Map<String, Integer> defaultRanks() {
		Map<String, Integer> ranks = new LinkedHashMap<>();
		put(ranks, 10, "absolute", "block", "contents", "fixed", "flex", "grid", "hidden", "inline",
				"inline-block", "inline-flex", "inline-grid", "relative", "static", "sticky");
		put(ranks, 20, "bottom-", "inset-", "left-", "right-", "top-");
		put(ranks, 25, "z-");
		put(ranks, 30, "basis-", "flex-", "grid-cols-", "grid-rows-");
		put(ranks, 40, "content-", "items-", "justify-", "place-", "self-");
		put(ranks, 45, "col-", "grow", "order-", "row-", "shrink");
		put(ranks, 50, "gap-");
		put(ranks, 60, "-m-", "-mx-", "-my-", "m-", "mb-", "ml-", "mr-", "mt-", "mx-", "my-");
		put(ranks, 70, "p-", "pb-", "pl-", "pr-", "pt-", "px-", "py-");
		put(ranks, 80, "h-", "max-h-", "max-w-", "min-h-", "min-w-", "size-", "w-");
		put(ranks, 90, "align-", "antialiased", "break-", "capitalize", "decoration-", "font-", "hyphens-",
				"italic", "leading-", "line-clamp-", "list-", "lowercase", "normal-case", "not-italic", "ordinal",
				"text-", "tracking-", "truncate", "underline", "uppercase", "whitespace-");
		put(ranks, 100, "bg-");
		put(ranks, 110, "border", "border-", "divide-", "outline-", "ring-", "rounded", "rounded-");
		put(ranks, 120, "blur", "blur-", "brightness-", "contrast-", "drop-shadow", "grayscale", "hue-rotate-",
				"invert", "opacity-", "saturate-", "sepia", "shadow", "shadow-");
		put(ranks, 130, "animate-", "delay-", "duration-", "ease-", "transition", "transition-");
		put(ranks, 140, "-rotate-", "-scale-", "-skew-", "-translate-", "origin-", "rotate-", "scale-", "skew-",
				"transform", "translate-");
		put(ranks, 150, "accent-", "appearance-", "caret-", "cursor-", "pointer-events-", "resize", "scroll-",
				"select-", "snap-", "touch-", "will-change-");
		put(ranks, 160, "fill-", "stroke-");
		put(ranks, 170, "sr-only");
		return ranks;
	}

	private static void put(Map<String, Integer> ranks, int rank, String... keys) {
		for (String key : keys) {
			ranks.put(key, rank);
		}
	}

	private static List<PatternRule> defaultRules() {
		String colored = "(bg|text|border|ring|divide|outline|fill|stroke)";
		List<PatternRule> rules = new ArrayList<>();
		rules.add(new PatternRule("^(sm|md|lg|xl|2xl):", TokenCategory.VARIANT));
		rules.add(new PatternRule("^(hover|focus|active|disabled|group-hover):", TokenCategory.VARIANT));
		rules.add(new PatternRule("^(dark|light):", TokenCategory.VARIANT));
		rules.add(new PatternRule("^(flex|grid|block|inline|hidden|absolute|relative|fixed|sticky)$", TokenCategory.LAYOUT));
		rules.add(new PatternRule("^(items|justify|content|self|place)-(start|end|center|between|around|evenly|stretch|baseline)$",
				TokenCategory.LAYOUT));
		rules.add(new PatternRule("^(flex|grid)-(row|col|wrap|nowrap|grow|shrink)", TokenCategory.LAYOUT));
		rules.add(new PatternRule("^(col|row)-span-", TokenCategory.LAYOUT));
		rules.add(new PatternRule("^gap-", TokenCategory.LAYOUT));
		rules.add(new PatternRule("^order-", TokenCategory.LAYOUT));
		rules.add(new PatternRule("^-?[mp][xytblr]?-\\d", TokenCategory.SPACING));
		rules.add(new PatternRule("^-?[mp][xytblr]?-\\[", TokenCategory.SPACING));
		rules.add(new PatternRule("^[wh]-", TokenCategory.SIZING));
		rules.add(new PatternRule("^(min|max)-[wh]-", TokenCategory.SIZING));
		rules.add(new PatternRule("^size-", TokenCategory.SIZING));
		rules.add(new PatternRule("^" + colored + "-(transparent|current|inherit)$", TokenCategory.COLOR));
		rules.add(new PatternRule("^" + colored + "-\\w+-\\d{2,3}$", TokenCategory.COLOR));
		rules.add(new PatternRule("^" + colored + "-(white|black)$", TokenCategory.COLOR));
		rules.add(new PatternRule("^text-(xs|sm|base|lg|xl|2xl|3xl|4xl|5xl|6xl|7xl|8xl|9xl)$", TokenCategory.TYPOGRAPHY));
		rules.add(new PatternRule("^text-(left|center|right|justify)$", TokenCategory.TYPOGRAPHY));
		rules.add(new PatternRule("^font-(thin|extralight|light|normal|medium|semibold|bold|extrabold|black)$",
				TokenCategory.TYPOGRAPHY));
		rules.add(new PatternRule("^font-(sans|serif|mono)$", TokenCategory.TYPOGRAPHY));
		rules.add(new PatternRule("^leading-", TokenCategory.TYPOGRAPHY));
		rules.add(new PatternRule("^tracking-", TokenCategory.TYPOGRAPHY));
		rules.add(new PatternRule("^(uppercase|lowercase|capitalize|normal-case)$", TokenCategory.TYPOGRAPHY));
		rules.add(new PatternRule("^(truncate|line-clamp-)", TokenCategory.TYPOGRAPHY));
		rules.add(new PatternRule("^rounded(-|$)", TokenCategory.BORDER));
		rules.add(new PatternRule("^border(-|$)", TokenCategory.BORDER));
		rules.add(new PatternRule("^ring(-|$)", TokenCategory.BORDER));
		rules.add(new PatternRule("^outline(-|$)", TokenCategory.BORDER));
		rules.add(new PatternRule("^shadow(-|$)", TokenCategory.EFFECT));
		rules.add(new PatternRule("^opacity-", TokenCategory.EFFECT));
		rules.add(new PatternRule("^blur(-|$)", TokenCategory.EFFECT));
		rules.add(new PatternRule("^(grayscale|sepia|invert|brightness|contrast|saturate|hue-rotate)(-|$)",
				TokenCategory.EFFECT));
		rules.add(new PatternRule("^transition(-|$)", TokenCategory.TRANSITION));
		rules.add(new PatternRule("^(duration|ease|delay|animate)-", TokenCategory.TRANSITION));
		rules.add(new PatternRule("^-?(rotate|scale|skew|translate)-", TokenCategory.TRANSFORM));
		rules.add(new PatternRule("^origin-", TokenCategory.TRANSFORM));
		rules.add(new PatternRule("^transform$", TokenCategory.TRANSFORM));
		rules.add(new PatternRule("^(cursor|select|pointer-events)-", TokenCategory.INTERACTIVITY));
		return rules;
	}
}
