package org.orchestration.migrator.odx;

import org.orchestration.migrator.odx.models.ShapeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingParseListener implements ParseListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingParseListener.class);

    @Override
    public void shapeParsed(ShapeNode node) {
        log.debug("Parsed {} '{}' (OID {}, seq {})", node.shapeType(), node.name(), node.oid(), node.sequence());
    }

    @Override
    public void unknownShape(String rawType, String oid) {
        log.debug("Unhandled shape type {} (OID {})", rawType, oid);
    }

    @Override
    public void metadataSkipped(String rawType, String oid) {
        log.trace("Skipped metadata element {} (OID {})", rawType, oid);
    }

    @Override
    public void branchIgnored(ShapeNode owner, String branchName) {
        log.warn("Decide '{}' has more than two branches, branch '{}' was not mapped", owner.name(), branchName);
    }

    @Override
    public void warning(String message) {
        log.warn(message);
    }
}
