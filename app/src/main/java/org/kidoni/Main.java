package org.kidoni;

import java.util.Map;

import org.kidoni.expr.Expr;
import org.kidoni.tree.Tree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.kidoni.expr.Expr.add;
import static org.kidoni.expr.Expr.mul;
import static org.kidoni.expr.Expr.num;
import static org.kidoni.expr.Expr.var;
import static org.kidoni.tree.Tree.leaf;
import static org.kidoni.tree.Tree.node;

public class Main {
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final String GREETING = "Hello, recursive data!";

    public static void main(String[] args) {
        System.out.println(GREETING);

        final Expr expr = mul(num(2), add(var("x"), var("y")));
        final Map<String, Integer> assignment = Map.of("x", 3, "y", 5);
        LOG.info("{} with {} = {}", expr.show(), assignment, expr.eval(assignment, 0));

        final Tree tree = node(7, leaf(2), node(3, node(5, leaf(1), leaf(8)), leaf(1)));
        LOG.info("{} sorted is {}", tree, tree.sort());
    }
}
