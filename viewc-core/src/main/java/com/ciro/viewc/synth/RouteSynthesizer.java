package com.ciro.viewc.synth;

import com.ciro.viewc.ast.ComponentDef;
import com.ciro.viewc.ast.Expr;
import com.ciro.viewc.ast.RouterDef;
import com.ciro.viewc.lower.Names;
import com.ciro.viewc.target.ChildRef;
import com.ciro.viewc.target.Instr;
import com.ciro.viewc.target.Mount;
import com.ciro.viewc.target.NodeRef;
import com.ciro.viewc.target.Procedure;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@code _sync_route} y {@code navigate(path)}. La ruta actual tiene como
 * mucho una instancia viva, montada delante del ancla de ruta.
 */
public class RouteSynthesizer {

    private static final String TARGET = "_target";

    private final ComponentDef def;

    public RouteSynthesizer(ComponentDef def) {
        this.def = def;
    }

    public List<Procedure> synthesize() {
        if (def.router() == null) return List.of();
        return List.of(sync(def.router()), navigate());
    }

    private Procedure sync(RouterDef router) {
        Expr target = Names.ref(TARGET);
        Expr current = Names.ref(Names.ROUTE_CURRENT);
        List<Instr> body = new ArrayList<>();

        body.add(new Instr.Let(TARGET, new Expr.Literal("")));
        for (RouterDef.Route r : router.routes()) {
            body.add(new Instr.Branch(
                    new Expr.Binary("==", Names.ref(Names.ROUTE_PATH), new Expr.Literal(r.path())),
                    List.of(new Instr.Let(TARGET, new Expr.Literal(r.component()))),
                    List.of()));
        }
        body.add(new Instr.Branch(new Expr.Binary("==", target, current), List.of(new Instr.Return(null)), List.of()));

        body.add(new Instr.Branch(new Expr.Binary("!=", current, new Expr.Literal("")),
                List.of(new Instr.CallChild(ChildRef.route(), Names.DESTROY)), List.of()));
        body.add(new Instr.Assign(current, target));

        Set<String> targets = new LinkedHashSet<>();
        for (RouterDef.Route r : router.routes()) targets.add(r.component());
        for (String component : targets) {
            body.add(new Instr.Branch(new Expr.Binary("==", target, new Expr.Literal(component)),
                    List.of(new Instr.Instantiate(ChildRef.route(), component),
                            new Instr.CallChild(ChildRef.route(), Names.VIEW,
                                    Mount.before(NodeRef.routeAnchor()), List.of())),
                    List.of()));
        }
        return new Procedure(Names.SYNC_ROUTE, Procedure.Kind.ROUTE, body);
    }

    private Procedure navigate() {
        return new Procedure(Names.NAVIGATE, Procedure.Kind.ROUTE, List.of("path"), List.of(
                new Instr.Assign(Names.ref(Names.ROUTE_PATH), Names.ref("path")),
                new Instr.Call(Names.SYNC_ROUTE)));
    }
}
