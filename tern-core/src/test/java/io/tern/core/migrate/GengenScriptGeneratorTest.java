package io.tern.core.migrate;

import com.google.common.collect.ImmutableList;
import io.tern.core.template.JinjaTemplateEngine;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.not;

public class GengenScriptGeneratorTest
{
    @Test
    public void generatesEveryMigrationInOrder()
        throws Exception
    {
        GengenScriptGenerator generator = new GengenScriptGenerator(new JinjaTemplateEngine(), "2.2.0");
        String script = generator.generate("public.schema_version", ImmutableList.of(
                    new SqlMigration(1, "001_create_t1.sql", "create table t1(id int);", "drop table t1;"),
                    new SqlMigration(2, "002_create_t2.sql", "create table t2(id int);", "")));

        assertThat(script, containsString("generated by tern gengen v2.2.0"));
        assertThat(script, containsString("select to_regclass('public.schema_version')"));
        assertThat(script, containsString("create table public.schema_version(version int4 not null);"));
        assertThat(script, containsString(", (1,\n$tern_gengen$\n-- 001_create_t1.sql\nbegin;\ncreate table t1(id int);$tern_gengen$)"));
        assertThat(script, containsString(", (2,\n$tern_gengen$\n-- 002_create_t2.sql\nbegin;\ncreate table t2(id int);$tern_gengen$)"));
        assertThat(script.indexOf("001_create_t1.sql"), lessThan(script.indexOf("002_create_t2.sql")));
        assertThat(script, not(containsString("drop table t1")));
        assertThat(script, containsString("update public.schema_version set version = "));
    }
}
