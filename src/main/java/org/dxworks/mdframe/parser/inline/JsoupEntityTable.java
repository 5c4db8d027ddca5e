package org.dxworks.mdframe.parser.inline;

import org.jsoup.nodes.Entities;

/**
 * The HTML5 named entity table shipped with jsoup. Stateless, so one instance serves every parse.
 */
public final class JsoupEntityTable implements EntityTable {

    public static final JsoupEntityTable INSTANCE = new JsoupEntityTable();

    private JsoupEntityTable() {}

    @Override
    public String lookup(String name) {
        if (name == null || name.isEmpty() || !Entities.isNamedEntity(name)) {
            return null;
        }
        String value = Entities.getByName(name);
        return value.isEmpty() ? null : value;
    }
}
