package com.proofaudit.pdg.glob;

import com.proofaudit.pdg.model.ByteRange;
import com.proofaudit.pdg.model.RawReference;

/**
 * A reference record: {@code R<start>:<end> <module> <secpath> <name> <kind>}.
 *
 * @param range      byte extent of the reference in the referencing file
 * @param modulePath logical module the target lives in
 * @param secPath    section path of the target, or null for {@code <>}
 * @param name       cleaned target name, or null when the record names the
 *                   module itself ({@code lib} references)
 * @param kindCode   kind code of the target
 */
public record GlobReference(ByteRange range, String modulePath, String secPath, String name, String kindCode) {

    public RawReference toRaw() {
        String target = name == null ? null : secPath == null ? name : secPath + "." + name;
        return new RawReference(modulePath, target, kindCode, range);
    }
}
