// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.entity;

import java.util.HashMap;
import java.util.Map;
import orgmark.util.annotation.Nullable;

/**
 * The built-in entity table: Greek letters, arrows, common typographic and mathematical symbols.
 * <p>
 * The table is immutable and can be shared between any number of parse sessions.
 */
public final class StandardEntities implements EntityTable {
    private StandardEntities(final Map<String, Entity> entities) {
        this.entities = entities;
    }

    /**
     * Returns the shared instance of the built-in table.
     */
    public static StandardEntities table() {
        return instance;
    }

    @Override
    public @Nullable Entity lookup(final String name) {
        return entities.get(name);
    }

    /**
     * Returns the number of entities the table knows.
     */
    public int size() {
        return entities.size();
    }

    private static Map<String, Entity> buildTable() {
        final var builder = new TableBuilder();

        builder.greek("alpha", "α");
        builder.greek("beta", "β");
        builder.greek("gamma", "γ");
        builder.greek("delta", "δ");
        builder.greek("epsilon", "ε");
        builder.greek("zeta", "ζ");
        builder.greek("eta", "η");
        builder.greek("theta", "θ");
        builder.greek("iota", "ι");
        builder.greek("kappa", "κ");
        builder.greek("lambda", "λ");
        builder.greek("mu", "μ");
        builder.greek("nu", "ν");
        builder.greek("xi", "ξ");
        builder.add("omicron", "\\textomicron{}", false, "&omicron;", "omicron", "omicron", "ο");
        builder.greek("pi", "π");
        builder.greek("rho", "ρ");
        builder.greek("sigma", "σ");
        builder.greek("tau", "τ");
        builder.greek("upsilon", "υ");
        builder.greek("phi", "φ");
        builder.greek("chi", "χ");
        builder.greek("psi", "ψ");
        builder.greek("omega", "ω");
        builder.greek("Gamma", "Γ");
        builder.greek("Delta", "Δ");
        builder.greek("Theta", "Θ");
        builder.greek("Lambda", "Λ");
        builder.greek("Xi", "Ξ");
        builder.greek("Pi", "Π");
        builder.greek("Sigma", "Σ");
        builder.greek("Phi", "Φ");
        builder.greek("Psi", "Ψ");
        builder.greek("Omega", "Ω");

        builder.add("rarr", "\\to", true, "&rarr;", "->", "->", "→");
        builder.add("to", "\\to", true, "&rarr;", "->", "->", "→");
        builder.add("larr", "\\leftarrow", true, "&larr;", "<-", "<-", "←");
        builder.add("uarr", "\\uparrow", true, "&uarr;", "|", "|", "↑");
        builder.add("darr", "\\downarrow", true, "&darr;", "|", "|", "↓");
        builder.add("harr", "\\leftrightarrow", true, "&harr;", "<->", "<->", "↔");
        builder.add("rArr", "\\Rightarrow", true, "&rArr;", "=>", "=>", "⇒");
        builder.add("Rightarrow", "\\Rightarrow", true, "&rArr;", "=>", "=>", "⇒");
        builder.add("lArr", "\\Leftarrow", true, "&lArr;", "<=", "<=", "⇐");
        builder.add("hArr", "\\Leftrightarrow", true, "&hArr;", "<=>", "<=>", "⇔");

        builder.add("nbsp", "~", false, "&nbsp;", " ", " ", " ");
        builder.add("ensp", "\\hspace*{.5em}", false, "&ensp;", " ", " ", " ");
        builder.add("emsp", "\\hspace*{1em}", false, "&emsp;", " ", " ", " ");
        builder.add("hellip", "\\dots{}", false, "&hellip;", "...", "...", "…");
        builder.add("dots", "\\dots{}", false, "&hellip;", "...", "...", "…");
        builder.add("mdash", "---", false, "&mdash;", "--", "--", "—");
        builder.add("ndash", "--", false, "&ndash;", "-", "-", "–");
        builder.add("laquo", "\\guillemotleft{}", false, "&laquo;", "<<", "«", "«");
        builder.add("raquo", "\\guillemotright{}", false, "&raquo;", ">>", "»", "»");
        builder.add("lsquo", "\\textquoteleft{}", false, "&lsquo;", "`", "`", "‘");
        builder.add("rsquo", "\\textquoteright{}", false, "&rsquo;", "'", "'", "’");
        builder.add("ldquo", "\\textquotedblleft{}", false, "&ldquo;", "\"", "\"", "“");
        builder.add("rdquo", "\\textquotedblright{}", false, "&rdquo;", "\"", "\"", "”");
        builder.add("bull", "\\textbullet{}", false, "&bull;", "*", "*", "•");
        builder.add("middot", "\\textperiodcentered{}", false, "&middot;", ".", "·", "·");
        builder.add("sect", "\\S", false, "&sect;", "paragraph", "§", "§");
        builder.add("para", "\\P{}", false, "&para;", "[pilcrow]", "¶", "¶");
        builder.add("dagger", "\\textdagger{}", false, "&dagger;", "[dagger]", "[dagger]", "†");

        builder.add("copy", "\\textcopyright{}", false, "&copy;", "(c)", "©", "©");
        builder.add("reg", "\\textregistered{}", false, "&reg;", "(r)", "®", "®");
        builder.add("trade", "\\texttrademark{}", false, "&trade;", "TM", "TM", "™");
        builder.add("euro", "\\texteuro{}", false, "&euro;", "EUR", "EUR", "€");
        builder.add("pound", "\\pounds{}", false, "&pound;", "pound", "£", "£");
        builder.add("yen", "\\textyen{}", false, "&yen;", "yen", "¥", "¥");
        builder.add("cent", "\\textcent{}", false, "&cent;", "cent", "¢", "¢");

        builder.add("deg", "\\textdegree{}", false, "&deg;", "degree", "°", "°");
        builder.add("pm", "\\textpm{}", false, "&plusmn;", "+-", "±", "±");
        builder.add("times", "\\texttimes{}", false, "&times;", "*", "×", "×");
        builder.add("div", "\\textdiv{}", false, "&divide;", "/", "÷", "÷");
        builder.add("le", "\\le", true, "&le;", "<=", "<=", "≤");
        builder.add("ge", "\\ge", true, "&ge;", ">=", ">=", "≥");
        builder.add("ne", "\\ne", true, "&ne;", "!=", "!=", "≠");
        builder.add("approx", "\\approx", true, "&asymp;", "~", "~", "≈");
        builder.add("infin", "\\infty", true, "&infin;", "[infinity]", "[infinity]", "∞");
        builder.add("infty", "\\infty", true, "&infin;", "[infinity]", "[infinity]", "∞");
        builder.add("sum", "\\sum", true, "&sum;", "[sum]", "[sum]", "∑");
        builder.add("prod", "\\prod", true, "&prod;", "[product]", "[n-ary product]", "∏");
        builder.add("radic", "\\sqrt{\\,}", true, "&radic;", "[square root]", "[square root]", "√");
        builder.add("forall", "\\forall", true, "&forall;", "[for all]", "[for all]", "∀");
        builder.add("exist", "\\exists", true, "&exist;", "[there exists]", "[there exists]", "∃");
        builder.add("isin", "\\in", true, "&isin;", "[element of]", "[element of]", "∈");
        builder.add("empty", "\\emptyset", true, "&empty;", "[empty set]", "[empty set]", "∅");
        builder.add("star", "\\star", true, "*", "*", "*", "⋆");
        builder.add("checkmark", "\\checkmark", true, "&#10003;", "[checkmark]", "[checkmark]", "✓");

        return Map.copyOf(builder.entities);
    }

    private static final StandardEntities instance = new StandardEntities(buildTable());

    private final Map<String, Entity> entities;

    private static final class TableBuilder {
        private void greek(final String name, final String glyph) {
            add(name, "\\" + name, true, "&" + name + ";", name, name, glyph);
        }

        private void add(
            final String name,
            final String latex,
            final boolean latexMath,
            final String html,
            final String ascii,
            final String latin1,
            final String unicode
        ) {
            final var previous = entities.put(name, new Entity(name, latex, latexMath, html, ascii, latin1, unicode));
            assert previous == null : "Duplicate entity " + name;
        }

        private final HashMap<String, Entity> entities = new HashMap<>();
    }
}
