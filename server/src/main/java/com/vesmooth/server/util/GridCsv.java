package com.vesmooth.server.util;

import com.vesmooth.server.grid.Grid;
import com.vesmooth.server.grid.InvalidGridException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Plain comma separated grid tables: one grid row per line, every field
 * numeric, blank lines ignored.
 */
public class GridCsv {

    public static double[][] read(Reader in) throws IOException {
        List<double[]> rows = new ArrayList<>();
        BufferedReader reader = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            if (line.trim().isEmpty()) {
                continue;
            }
            String[] fields = line.split(",", -1);
            double[] row = new double[fields.length];
            for (int i = 0; i < fields.length; i++) {
                String f = fields[i].trim();
                try {
                    row[i] = Double.parseDouble(f);
                } catch (NumberFormatException e) {
                    throw new InvalidGridException("csv", rows.size(), i,
                            "Unparseable value '" + f + "' on line " + lineNo);
                }
            }
            rows.add(row);
        }
        return rows.toArray(new double[0][]);
    }

    /**
     * Writes the values of a grid using the shortest representation that
     * round-trips each double.
     */
    public static void write(Grid grid, Writer out) throws IOException {
        StringBuilder sb = new StringBuilder();
        for (int r = 0; r < grid.getRows(); r++) {
            sb.setLength(0);
            for (int c = 0; c < grid.getCols(); c++) {
                if (c > 0)
                    sb.append(',');
                sb.append(Double.toString(grid.getValue(r, c)));
            }
            sb.append('\n');
            out.write(sb.toString());
        }
        out.flush();
    }
}
