/*
 * Copyright (C) 2015 The Android Open Source Project
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

// Drives expr_calc one line at a time and checks what it prints.

import com.hp.exprcalc.Settings;

import junit.framework.TestCase;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

public class ExprCalcDriverTest extends TestCase {
    private ByteArrayOutputStream bytes;
    private PrintStream out;

    @Override
    protected void setUp() {
        expr_calc.init(Settings.defaults());
        bytes = new ByteArrayOutputStream();
        out = new PrintStream(bytes, true);
    }

    // Run lines and return the printed lines.
    private String[] run(String... lines) {
        for (String line : lines) {
            assertTrue(line, expr_calc.process_line(line, out));
        }
        String text = bytes.toString().replace("\r\n", "\n");
        bytes.reset();
        return text.length() == 0 ? new String[0] : text.split("\n");
    }

    public void testExpression() {
        String[] lines = run("1-2*12-3^2", "1/0", "1+", "");
        assertEquals(3, lines.length);
        assertEquals("-32.00000000", lines[0]);
        assertEquals("Error in calculation", lines[1]);
        assertEquals("Error in input", lines[2]);
    }

    public void testSetX() {
        String[] lines = run("x=2", "x^3", "x=abc", "x");
        assertEquals("x = 2", lines[0]);
        assertEquals("8.00000000", lines[1]);
        assertEquals("x = 2", lines[2]);
        assertEquals("2.00000000", lines[3]);
    }

    public void testGraph() {
        String[] lines = run("axis 0 1 -5 5", "graph 2x");
        assertEquals(100, lines.length);
        assertEquals("0.0 0.0", lines[0]);
        assertEquals("0.5 1.0", lines[50]);
    }

    public void testGraphErrors() {
        assertEquals("Incorrect input", run("graph 2*")[0]);
        assertEquals("Invalid cords", run("axis 1 0 0 1")[0]);
        assertEquals("Invalid cords", run("graph x")[0]);
        assertEquals("Invalid cords", run("axis 1 2 3")[0]);
    }

    public void testShortAxisLineBlocksPlotting() {
        run("axis 0 1 -5 5");
        String[] lines = run("axis 0 2 -5", "graph x");
        assertEquals(2, lines.length);
        assertEquals("Invalid cords", lines[0]);
        assertEquals("Invalid cords", lines[1]);
        assertEquals(100, run("axis 0 1 -5 5", "graph x").length);
    }

    public void testHelpAndQuit() {
        String[] lines = run("h");
        assertTrue(lines.length > 10);
        assertTrue(lines[lines.length - 1].startsWith("exprcalc.axis_limit"));
        assertFalse(expr_calc.process_line("q", out));
    }
}
