// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.test;

import java.util.ArrayList;
import java.util.List;
import orgmark.entity.Entity;
import orgmark.entity.EntityTable;
import orgmark.entity.StandardEntities;
import orgmark.inline.Node;
import orgmark.inline.ParseSession;
import orgmark.inline.UnknownEntityCondition;
import orgmark.timestamp.IsoDateTimeParser;
import orgmark.util.condition.Handler;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class EntityTest {
    @Test
    void knownEntityIsResolved() {
        final var alpha = StandardEntities.table().lookup("alpha");
        assertThat(alpha).isEqualTo(new Entity("alpha", "\\alpha", true, "&alpha;", "alpha", "alpha", "α"));
        assertThat(ParseSession.withDefaults().parse("\\alpha2"))
            .containsExactly(new Node.EntityReference(alpha), new Node.Plain("2"));
    }

    @Test
    void unknownEntityFallsBackToPlainText() {
        final var unknown = new ArrayList<String>();
        final List<Node> nodes;
        try (final var handler = new Handler(c -> {
            if (c.condition() instanceof UnknownEntityCondition condition) {
                assertThat(c.isFatal()).isFalse();
                unknown.add(condition.entityName());
            }
        })) {
            handler.use();
            nodes = new ParseSession(EntityTable.empty(), IsoDateTimeParser.instance()).parse("\\nosuchentity");
        }
        assertThat(nodes).containsExactly(new Node.Plain("nosuchentity"));
        assertThat(unknown).containsExactly("nosuchentity");
    }

    @Test
    void unknownEntityWithoutHandlerIsNotAnError() {
        assertThat(ParseSession.withDefaults().parse("a \\bogus b")).containsExactly(new Node.Plain("a bogus b"));
    }

    @Test
    void customTableIsConsulted() {
        final var heart = new Entity("heart", "\\heartsuit", true, "&hearts;", "<3", "<3", "♥");
        final EntityTable table = name -> name.equals("heart") ? heart : null;
        final var session = new ParseSession(table, IsoDateTimeParser.instance());
        assertThat(session.parse("I \\heart it"))
            .containsExactly(new Node.Plain("I "), new Node.EntityReference(heart), new Node.Plain(" it"));
    }

    @Test
    void standardTableIsPopulated() {
        assertThat(StandardEntities.table().size()).isGreaterThan(50);
        assertThat(StandardEntities.table().lookup("rarr")).isNotNull();
        assertThat(StandardEntities.table().lookup("nosuchentity")).isNull();
    }
}
