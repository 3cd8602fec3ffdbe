/*
 * Copyright (c) 2001 Hewlett-Packard Company
 *
 * Permission to use, copy, modify, distribute and sell this software
 * and its documentation for any purpose is hereby granted without fee,
 * provided that the above copyright notice appear in all copies and
 * that both that copyright notice and this permission notice appear
 * in supporting documentation.
 * HEWLETT-PACKARD COMPANY MAKES NO REPRESENTATIONS ABOUT THE SUITABILITY
 * OF THIS SOFTWARE FOR ANY PURPOSE.  IT IS PROVIDED "AS IS" WITHOUT
 * EXPRESS OR IMPLIED WARRANTY.
 */

//
// A simple line oriented driver for the expression calculator and the
// function grapher.  Each input line is either a command or an infix
// expression, which is evaluated at the current value of x.
// This driver is completely single-threaded.
//

import com.hp.exprcalc.SamplePoint;
import com.hp.exprcalc.Settings;
import com.hp.exprcalc.frontend.CalculatorModel;
import com.hp.exprcalc.frontend.GraphModel;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;

class expr_calc {
    static String help_string = "This is an infix expression calculator.\n" +
	"Each input line is an expression in the variable x, or a command.\n" +
	"The result of an expression is printed with " +
	"the configured number of decimals.\n\n" +
	"Operators: + - * / mod ^ and unary -\n" +
	"Functions: sin cos tan asin acos atan sqrt ln log " +
	"(radians, log is base 10)\n" +
	"Writing 2x or 2(x+1) multiplies.\n\n" +
	"Commands:\n" +
	"x=<value>          set x\n" +
	"axis a b c d       set graph range a <= x < b, c <= y <= d\n" +
	"graph <expression> print the points of the graph\n" +
	"h (print help); q (exit)\n\n" +
	"System properties:\n";

    static void print_help(PrintStream out) {
	out.print(help_string);
	for (String[] param : Settings.PARAM_INFO) {
	    out.println(param[0] + " (" + param[1] + "): " + param[2]);
	}
    }

    static CalculatorModel calculator;
    static GraphModel graph;
    static String x_text = "0";
    static String graph_message = "";

    static void set_x(String text, PrintStream out) {
	x_text = calculator.setX(text.trim(), x_text);
	out.println("x = " + x_text);
    }

    static void set_axis(String args, PrintStream out) {
	String[] bounds = args.trim().split("\\s+");
	if (bounds.length != 4) {
	    graph_message = GraphModel.INVALID_CORDS;
	    out.println(graph_message);
	    return;
	}
	graph_message = graph.setAxis("", bounds[0], bounds[1], bounds[2], bounds[3]);
	if (graph_message.length() != 0) out.println(graph_message);
    }

    static void plot(String text, PrintStream out) {
	String msg = graph.check(text);
	if (msg.length() != 0) {
	    out.println(msg);
	    return;
	}
	if (graph_message.length() != 0) {
	    // Last axis update failed; the ranges must be fixed first.
	    out.println(graph_message);
	    return;
	}
	graph.calculateGraph(text);
	for (SamplePoint p : graph.getPoints()) {
	    out.println(p.x() + " " + p.y());
	}
    }

    // Process one input line.  Returns false on the exit command.
    static boolean process_line(String line, PrintStream out) {
	String cmd = line.trim();
	if (cmd.equals("q") || cmd.equals("Q")) {
	    return false;
	} else if (cmd.equals("h") || cmd.equals("H")) {
	    print_help(out);
	} else if (cmd.startsWith("x=")) {
	    set_x(cmd.substring(2), out);
	} else if (cmd.startsWith("axis ")) {
	    set_axis(cmd.substring(5), out);
	} else if (cmd.startsWith("graph ")) {
	    plot(cmd.substring(6), out);
	} else if (cmd.length() != 0) {
	    out.println(calculator.calculateValue(line));
	}
	return true;
    }

    static void init(Settings settings) {
	calculator = new CalculatorModel(settings);
	graph = new GraphModel(settings);
	x_text = "0";
	graph_message = "";
    }

    public static void main(String argv[]) throws IOException {
	init(Settings.fromSystemProperties());
	BufferedReader in = new BufferedReader(new InputStreamReader(System.in));
	String line;
	while ((line = in.readLine()) != null) {
	    if (!process_line(line, System.out)) return;
	}
    }
}
