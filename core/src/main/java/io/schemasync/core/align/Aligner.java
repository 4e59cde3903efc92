// file: core/src/main/java/io/schemasync/core/align/Aligner.java
package io.schemasync.core.align;

import io.schemasync.core.ObjectNotFoundException;
import io.schemasync.core.TypeMismatchException;
import io.schemasync.core.declared.DeclaredNode;
import io.schemasync.core.live.MutationJournal;
import io.schemasync.core.live.ReflectedNode;
import io.schemasync.core.model.AttributeSpec;
import io.schemasync.core.model.AttributeRegistry;
import io.schemasync.core.model.EntityType;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives a live subtree to match a declared subtree.
 * <p>
 * Per entity:
 *  1. the declared and live types must agree (fatal otherwise),
 *  2. attributes are compared in registry order and every difference is set,
 *  3. for every child type the declaration mentions: undeclared live children
 *     are deleted unless ignored, then each declared child is renamed from its
 *     old name if needed, matched or created, and aligned recursively.
 * <p>
 * Deletions run before creations so a replacement never collides with the
 * object it replaces. Child types absent from the declaration are left alone.
 * Running twice against an unchanged declaration applies nothing the second time.
 */
public final class Aligner {
    private static final Logger log = Logger.getLogger(Aligner.class.getName());

    public AlignmentReport align(DeclaredNode declared, ReflectedNode reflected) {
        return align(declared, reflected, true);
    }

    /**
     * @param alignChildren false to converge only the entity's own attributes
     */
    public AlignmentReport align(DeclaredNode declared, ReflectedNode reflected, boolean alignChildren) {
        MutationJournal journal = reflected.session().journal();
        int mark = journal.size();
        alignEntity(declared, reflected, alignChildren);
        AlignmentReport report = new AlignmentReport(journal.since(mark));
        log.log(Level.INFO, "Aligned " + reflected + ": " + report.summary());
        return report;
    }

    private void alignEntity(DeclaredNode declared, ReflectedNode reflected, boolean alignChildren) {
        if (declared.type() != reflected.type()) {
            throw new TypeMismatchException(reflected.fullName(),
                    "declared " + declared.type() + " cannot be aligned with live " + reflected.type());
        }
        log.log(Level.FINE, "Aligning " + reflected);

        for (AttributeSpec spec : AttributeRegistry.specs(declared.type())) {
            Object wanted = declared.attribute(spec.name());
            if (spec.optional() && wanted == null) {
                continue;
            }
            Object current = reflected.attribute(spec.name());
            if (!spec.sameValue(wanted, current)) {
                log.log(Level.INFO, reflected + " \"" + spec.name() + "\" differs: declared "
                        + wanted + ", live " + current);
                reflected.setAttribute(declared, spec.name());
            }
        }

        if (alignChildren) {
            for (EntityType childType : declared.type().childTypes()) {
                alignChildType(declared, reflected, childType);
            }
        }
    }

    private void alignChildType(DeclaredNode declared, ReflectedNode reflected, EntityType childType) {
        if (!declared.hasChildren(childType)) {
            log.log(Level.FINE, "No " + childType + " declared for " + reflected + ", leaving live ones alone");
            return;
        }

        if (!declared.ignoresExtraChildren(childType)) {
            for (ReflectedNode live : reflected.children(childType)) {
                boolean declaredSomewhere = declared.children(childType).stream().anyMatch(live::matches);
                if (!declaredSomewhere) {
                    live.delete();
                }
            }
        }

        for (DeclaredNode child : declared.children(childType)) {
            if (child.oldName() != null && !child.oldName().equalsIgnoreCase(child.name())) {
                renameFromOldName(reflected, child);
            }
            Optional<ReflectedNode> live = reflected.getOrCreateChild(child);
            live.ifPresent(node -> alignEntity(child, node, true));
        }
    }

    private void renameFromOldName(ReflectedNode parent, DeclaredNode child) {
        try {
            ReflectedNode old = parent.child(child.type(), child.oldName());
            old.rename(child.name());
        } catch (ObjectNotFoundException e) {
            log.log(Level.FINE, "Nothing to rename from " + child.oldName() + ": " + e.getMessage());
        }
    }
}
