/*
 * Copyright [2012-2014] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.dataprep.container.obj;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * TableTest class
 */
public class TableTest {

    private Table genTable() {
        return Table.of(Column.ofLongs("id", 1L, 2L, 3L), Column.ofDoubles("value", 1.5d, null, 3.5d),
                Column.ofStrings("name", "a", "b", null));
    }

    @Test
    public void testBasics() {
        Table table = genTable();
        Assert.assertEquals(table.getRowCount(), 3);
        Assert.assertEquals(table.getColumnCount(), 3);
        Assert.assertEquals(table.getColumnNames(), Arrays.asList("id", "value", "name"));
        Assert.assertTrue(table.hasColumn("value"));
        Assert.assertFalse(table.hasColumn("other"));
        Assert.assertEquals(table.getNumericalColumns().size(), 2);
        Assert.assertEquals(table.getRow(0), Arrays.<Object> asList(1L, 1.5d, "a"));
        Assert.assertFalse(table.hasMissing(0));
        Assert.assertTrue(table.hasMissing(1));
        Assert.assertTrue(table.hasMissing(2));
    }

    @Test
    public void testEmpty() {
        Assert.assertTrue(Table.empty().isEmpty());
        Assert.assertEquals(Table.empty().getColumnCount(), 0);

        Table noRows = Table.of(Column.ofLongs("id"));
        Assert.assertTrue(noRows.isEmpty());
        Assert.assertEquals(noRows.getColumnCount(), 1);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnequalLength() {
        Table.of(Column.ofLongs("a", 1L, 2L), Column.ofLongs("b", 1L));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testDuplicatedName() {
        Table.of(Column.ofLongs("a", 1L), Column.ofLongs("a", 2L));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnknownColumn() {
        genTable().getColumn("other");
    }

    @Test(expectedExceptions = IndexOutOfBoundsException.class)
    public void testRowOutOfRange() {
        genTable().getRow(3);
    }

    @Test
    public void testSelectRows() {
        Table selected = genTable().selectRows(Arrays.asList(2, 0));
        Assert.assertEquals(selected.getRowCount(), 2);
        Assert.assertEquals(selected.getColumn("id").getValues(), Arrays.<Object> asList(3L, 1L));
        Assert.assertEquals(selected.getColumn("name").getValues(), Arrays.<Object> asList(null, "a"));
    }

    @Test
    public void testWithColumn() {
        Table table = genTable();
        Table replaced = table.withColumn(Column.ofDoubles("value", 1d, 2d, 3d));
        Assert.assertEquals(replaced.getColumnNames(), Arrays.asList("id", "value", "name"));
        Assert.assertEquals(replaced.getColumn("value").getMissingCount(), 0);
        Assert.assertEquals(table.getColumn("value").getMissingCount(), 1);

        Table appended = table.withColumn(Column.ofLongs("extra", 0L, 0L, 0L));
        Assert.assertEquals(appended.getColumnNames(), Arrays.asList("id", "value", "name", "extra"));
    }

    @Test
    public void testCountMissingValues() {
        Map<String, Integer> expected = new LinkedHashMap<String, Integer>();
        expected.put("id", 0);
        expected.put("value", 1);
        expected.put("name", 1);
        Assert.assertEquals(genTable().countMissingValues(), expected);
    }

    @Test
    public void testEquals() {
        Assert.assertEquals(genTable(), genTable());
        Assert.assertEquals(genTable().hashCode(), genTable().hashCode());
        Assert.assertNotEquals(genTable(), genTable().selectRows(Arrays.asList(0, 1)));
    }

}
