package io.tern.core.sqlsplit;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;

public class SqlSplitterTest
{
    @Test
    public void splitsOnSemicolons()
    {
        assertThat(SqlSplitter.split("select 1;\nselect 2;\n  select 3;  "),
                contains("select 1;", "select 2;", "select 3;"));
    }

    @Test
    public void twoStatements()
    {
        assertThat(SqlSplitter.split("select 1; select 2;"), contains("select 1;", "select 2;"));
        assertThat(SqlSplitter.split("select $$a;b$$;"), contains("select $$a;b$$;"));
        assertThat(SqlSplitter.split("/* /* x; */ */select 1;"), contains("/* /* x; */ */select 1;"));
    }

    @Test
    public void keepsLastStatementWithoutSemicolon()
    {
        assertThat(SqlSplitter.split("select 1; select 2"),
                contains("select 1;", "select 2"));
    }

    @Test
    public void wholeInputWhenNothingToSplit()
    {
        assertThat(SqlSplitter.split("   "), contains("   "));
        assertThat(SqlSplitter.split(""), contains(""));
    }

    @Test
    public void ignoresSemicolonsInStringLiterals()
    {
        assertThat(SqlSplitter.split("insert into t values ('a;b', 'it''s;');select 1;"),
                contains("insert into t values ('a;b', 'it''s;');", "select 1;"));
    }

    @Test
    public void ignoresSemicolonsInEscapeStrings()
    {
        assertThat(SqlSplitter.split("select E'\\';';select 2;"),
                contains("select E'\\';';", "select 2;"));
    }

    @Test
    public void ignoresSemicolonsInQuotedIdentifiers()
    {
        assertThat(SqlSplitter.split("create table \"a;\"\"b\"(id int);drop table x;"),
                contains("create table \"a;\"\"b\"(id int);", "drop table x;"));
    }

    @Test
    public void ignoresSemicolonsInDollarQuotes()
    {
        String function = "create function f() returns int as $body$\n"
            + "begin\n"
            + "  return 1;\n"
            + "end;\n"
            + "$body$ language plpgsql;";
        assertThat(SqlSplitter.split(function + "\nselect f();"),
                contains(function, "select f();"));

        String anonymous = "do $$ begin perform 1; end $$;";
        assertThat(SqlSplitter.split(anonymous + "select 1;"),
                contains(anonymous, "select 1;"));
    }

    @Test
    public void positionalParametersAreNotDollarQuotes()
    {
        assertThat(SqlSplitter.split("prepare p as select $1;select 2;"),
                contains("prepare p as select $1;", "select 2;"));
    }

    @Test
    public void ignoresSemicolonsInComments()
    {
        assertThat(SqlSplitter.split("-- a; b\nselect 1;/* c; /* nested; */ d; */select 2;"),
                contains("-- a; b\nselect 1;", "/* c; /* nested; */ d; */select 2;"));
    }
}
