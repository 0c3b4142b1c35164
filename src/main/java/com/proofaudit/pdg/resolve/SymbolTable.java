package com.proofaudit.pdg.resolve;

import com.proofaudit.pdg.model.ScannedDeclaration;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Project-wide name table.
 *
 * <p>
 * Two levels:
 * <ul>
 * <li><b>Qualified names</b> are authoritative. The first declaration
 * registered under a qualified name owns it; later ones are rejected and
 * reported through {@link #duplicates()}.</li>
 * <li><b>Short names</b> are a fallback index from bare name to qualified
 * name, built once with a {@link ShortNamePolicy}. When several declarations
 * share a bare name, the losers are kept in {@link #collisions()} so callers
 * can tell an ambiguous hit from a unique one.</li>
 * </ul>
 *
 * <p>
 * Registration order is the order scans are merged in, i.e. the input order of
 * the files, so the outcome is deterministic.
 */
@Log4j2
public final class SymbolTable {

    /** How a bare name shared by several declarations is resolved. */
    public enum ShortNamePolicy {
        /** The declaration registered first owns the short name. */
        FIRST_REGISTERED
    }

    private final Map<String, ScannedDeclaration> byQualified;
    private final Map<String, String> byShort;
    private final Map<String, List<String>> collisions;
    private final List<ScannedDeclaration> duplicates;
    private final Set<String> modules;
    private final ShortNamePolicy policy;

    private SymbolTable(Map<String, ScannedDeclaration> byQualified, Map<String, String> byShort,
            Map<String, List<String>> collisions, List<ScannedDeclaration> duplicates, Set<String> modules,
            ShortNamePolicy policy) {
        this.byQualified = byQualified;
        this.byShort = byShort;
        this.collisions = collisions;
        this.duplicates = duplicates;
        this.modules = modules;
        this.policy = policy;
    }

    public int size() {
        return byQualified.size();
    }

    /** Registered declarations in registration order. */
    public Collection<ScannedDeclaration> declarations() {
        return byQualified.values();
    }

    public boolean contains(String qualifiedName) {
        return byQualified.containsKey(qualifiedName);
    }

    /** Declaration registered under exactly this qualified name, or null. */
    public ScannedDeclaration lookup(String qualifiedName) {
        return byQualified.get(qualifiedName);
    }

    /** Qualified name owning this bare name under the table's policy, or null. */
    public String byShortName(String shortName) {
        return byShort.get(shortName);
    }

    /**
     * Two-level lookup: qualified name first, short name second.
     *
     * @return the qualified name of the target, or null
     */
    public String resolve(String name) {
        return byQualified.containsKey(name) ? name : byShort.get(name);
    }

    /** Bare names claimed by more than one declaration, with every claimant in registration order. */
    public Map<String, List<String>> collisions() {
        return collisions;
    }

    /** Declarations rejected because their qualified name was already taken. */
    public List<ScannedDeclaration> duplicates() {
        return duplicates;
    }

    /** Logical module paths of the scanned files. */
    public Set<String> modules() {
        return modules;
    }

    /** True if {@code qualifiedName} lies inside, or {@code modulePath} is, a project module. */
    public boolean isProjectName(String qualifiedName, String modulePath) {
        for (String m : modules) {
            if (m.equals(modulePath) || qualifiedName.startsWith(m + "."))
                return true;
        }
        return false;
    }

    public ShortNamePolicy policy() {
        return policy;
    }

    public static Builder builder() {
        return new Builder(ShortNamePolicy.FIRST_REGISTERED);
    }

    public static Builder builder(ShortNamePolicy policy) {
        return new Builder(policy);
    }

    public static final class Builder {
        private final ShortNamePolicy policy;
        private final Map<String, ScannedDeclaration> byQualified = new LinkedHashMap<>();
        private final Map<String, List<String>> claimants = new LinkedHashMap<>();
        private final List<ScannedDeclaration> duplicates = new ArrayList<>();
        private final Set<String> modules = new LinkedHashSet<>();

        private Builder(ShortNamePolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy");
        }

        /**
         * Registers a declaration.
         *
         * @return false if the qualified name was already taken; the
         *         declaration is then ignored
         */
        public boolean register(ScannedDeclaration decl) {
            ScannedDeclaration existing = byQualified.get(decl.qualifiedName());
            if (existing != null) {
                log.warn("Duplicate symbol {} in {}:{}, keeping the one from {}:{}", decl.qualifiedName(),
                        decl.file(), decl.line(), existing.file(), existing.line());
                duplicates.add(decl);
                return false;
            }
            byQualified.put(decl.qualifiedName(), decl);
            claimants.computeIfAbsent(decl.name(), k -> new ArrayList<>()).add(decl.qualifiedName());
            return true;
        }

        public Builder addModule(String logicalPath) {
            if (logicalPath != null && !logicalPath.isEmpty())
                modules.add(logicalPath);
            return this;
        }

        public SymbolTable build() {
            Map<String, String> byShort = new HashMap<>(claimants.size() * 2);
            Map<String, List<String>> collisions = new TreeMap<>();
            for (var entry : claimants.entrySet()) {
                List<String> owners = entry.getValue();
                switch (policy) {
                    case FIRST_REGISTERED -> byShort.put(entry.getKey(), owners.get(0));
                }
                if (owners.size() > 1)
                    collisions.put(entry.getKey(), List.copyOf(owners));
            }
            if (!collisions.isEmpty())
                log.debug("{} short names are ambiguous, resolved {}", collisions.size(), policy);
            return new SymbolTable(Collections.unmodifiableMap(byQualified), Collections.unmodifiableMap(byShort),
                    Collections.unmodifiableMap(collisions), List.copyOf(duplicates),
                    Collections.unmodifiableSet(modules), policy);
        }
    }
}
