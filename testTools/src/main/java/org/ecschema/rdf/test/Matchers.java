package org.ecschema.rdf.test;

import static org.ecschema.rdf.test.StatementHelper.statement;

import java.util.Collection;

import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;
import org.openrdf.model.Statement;

/**
 * Useful matchers for RDF.
 */
public final class Matchers {
    /**
     * Check that a graph contains a statement.
     */
    public static Matcher<Collection<Statement>> hasStatement(String s, String p, Object o) {
        return new HasStatementMatcher(statement(s, p, o));
    }

    /**
     * Check that a graph contains a statement.
     */
    public static Matcher<Collection<Statement>> hasStatement(Statement statement) {
        return new HasStatementMatcher(statement);
    }

    /**
     * Checks that a statement is part of a graph.
     */
    private static class HasStatementMatcher extends TypeSafeMatcher<Collection<Statement>> {
        /**
         * The statement to look for.
         */
        private final Statement statement;

        HasStatementMatcher(Statement statement) {
            this.statement = statement;
        }

        @Override
        public void describeTo(Description description) {
            description.appendText("contains the statement ").appendValue(statement);
        }

        @Override
        protected void describeMismatchSafely(Collection<Statement> item, Description mismatchDescription) {
            mismatchDescription.appendText("but it was missing from the ").appendValue(item.size())
                    .appendText(" statements");
        }

        @Override
        protected boolean matchesSafely(Collection<Statement> item) {
            return item.contains(statement);
        }
    }

    private Matchers() {
        // Utility constructor
    }
}
