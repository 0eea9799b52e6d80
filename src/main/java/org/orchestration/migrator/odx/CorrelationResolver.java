package org.orchestration.migrator.odx;

import org.orchestration.migrator.odx.models.CorrelationReference;
import org.orchestration.migrator.odx.models.ShapeKind;
import org.orchestration.migrator.odx.models.ShapeNode;
import org.orchestration.migrator.odx.models.ShapePayload;
import org.orchestration.migrator.odx.models.ShapeTree;

import java.util.Optional;

/**
 * Second pass over a finished tree: copies correlation set names onto the Receive
 * shapes that initialize or follow them. References to unknown OIDs or to shapes
 * other than Receive are ignored.
 */
public class CorrelationResolver {

    /**
     * @param tree the complete node arena, branches and cases included
     * @return number of correlation set names newly attached
     */
    public static int resolve(ShapeTree tree) {
        int attached = 0;
        for (ShapeNode node : tree.allNodes()) {
            if (!node.is(ShapeKind.CORRELATION_DECLARATION)) {
                continue;
            }
            ShapePayload.CorrelationDeclaration declaration =
                    node.payload(ShapePayload.CorrelationDeclaration.class);
            for (CorrelationReference reference : declaration.statementReferences()) {
                Optional<ShapeNode> target = tree.findByOid(reference.statementOid());
                if (target.isEmpty() || !target.get().is(ShapeKind.RECEIVE)) {
                    continue;
                }
                ShapePayload.Receive receive = target.get().payload(ShapePayload.Receive.class);
                ShapePayload.Receive updated = receive.withCorrelationSet(node.name(), reference.initializes());
                if (updated != receive) {
                    tree.replace(target.get(), updated);
                    attached++;
                }
            }
        }
        return attached;
    }
}
