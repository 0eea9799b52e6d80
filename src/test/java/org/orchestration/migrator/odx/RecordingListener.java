package org.orchestration.migrator.odx;

import org.orchestration.migrator.odx.models.ShapeNode;

import java.util.ArrayList;
import java.util.List;

class RecordingListener implements ParseListener {
    final List<String> parsedTypes = new ArrayList<>();
    final List<String> unknownTypes = new ArrayList<>();
    final List<String> skippedTypes = new ArrayList<>();
    final List<String> ignoredBranches = new ArrayList<>();
    final List<String> warnings = new ArrayList<>();

    @Override
    public void shapeParsed(ShapeNode node) {
        parsedTypes.add(node.shapeType());
    }

    @Override
    public void unknownShape(String rawType, String oid) {
        unknownTypes.add(rawType);
    }

    @Override
    public void metadataSkipped(String rawType, String oid) {
        skippedTypes.add(rawType);
    }

    @Override
    public void branchIgnored(ShapeNode owner, String branchName) {
        ignoredBranches.add(branchName);
    }

    @Override
    public void warning(String message) {
        warnings.add(message);
    }
}
