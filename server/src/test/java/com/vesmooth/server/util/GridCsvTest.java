package com.vesmooth.server.util;

import com.vesmooth.server.grid.Grid;
import com.vesmooth.server.grid.InvalidGridException;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

public class GridCsvTest {

    @Test
    public void testReadSkipsBlankLines() throws Exception {
        double[][] values = GridCsv.read(new StringReader("1.5, 2\n\n-3,4.25\n"));
        assertArrayEquals(new double[][] { { 1.5, 2.0 }, { -3.0, 4.25 } }, values);
    }

    @Test
    public void testReadRejectsText() {
        InvalidGridException e = assertThrows(InvalidGridException.class,
                () -> GridCsv.read(new StringReader("1,2\n3,abc\n")));
        assertEquals(1, e.getRow());
        assertEquals(1, e.getCol());
    }

    @Test
    public void testWriteKeepsFullPrecision() throws Exception {
        Grid g = Grid.fromValues(new double[][] { { 52.5, 0.1 }, { 3.0, -7.0 } });
        StringWriter out = new StringWriter();
        GridCsv.write(g, out);

        assertEquals("52.5,0.1\n3.0,-7.0\n", out.toString());
        assertArrayEquals(g.toValues(), GridCsv.read(new StringReader(out.toString())));
    }
}
