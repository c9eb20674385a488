package com.datapatch.interpret;

import com.datapatch.ast.MixinDefinition;
import com.datapatch.ast.Patch;
import com.datapatch.host.AssetCreator;
import com.datapatch.select.RulesetRegistry;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The tables one compilation unit runs against: active mods, selector rulesets, functions,
 * mixins, importable libraries and the asset creator. Immutable once built, so one environment
 * can serve interpreters on several threads.
 */
public final class PatchEnvironment {

    public static final String DEFAULT_ELEMENT_TYPE_KEY = "type";
    public static final String DEFAULT_CLASSES_KEY = "classes";
    public static final long DEFAULT_LOOP_LIMIT = 1_000_000L;

    private final Set<String> activeMods;
    private final RulesetRegistry rulesets;
    private final Map<String, PatchFunction> functions;
    private final Map<String, MixinDefinition> mixins;
    private final Map<String, Patch> libraries;
    private final AssetCreator assetCreator;
    private final String elementTypeKey;
    private final String classesKey;
    private final long loopLimit;

    private PatchEnvironment(Builder builder) {
        this.activeMods = Set.copyOf(builder.activeMods);
        this.rulesets = builder.rulesets;
        this.functions = Map.copyOf(builder.functions);
        this.mixins = Map.copyOf(builder.mixins);
        this.libraries = Map.copyOf(builder.libraries);
        this.assetCreator = builder.assetCreator;
        this.elementTypeKey = builder.elementTypeKey;
        this.classesKey = builder.classesKey;
        this.loopLimit = builder.loopLimit;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builtins only, no mods, rulesets or libraries.
     */
    public static PatchEnvironment defaults() {
        return builder().build();
    }

    public boolean isModActive(String mod) {
        return activeMods.contains(mod);
    }

    public Set<String> activeMods() {
        return activeMods;
    }

    public RulesetRegistry rulesets() {
        return rulesets;
    }

    /**
     * @return the function registered under {@code name}, or null
     */
    public PatchFunction function(String name) {
        return functions.get(name);
    }

    /**
     * @return the mixin registered under {@code name}, or null
     */
    public MixinDefinition mixin(String name) {
        return mixins.get(name);
    }

    /**
     * @return the library registered under {@code name}, or null
     */
    public Patch library(String name) {
        return libraries.get(name);
    }

    /**
     * @return the asset creator, or null when the host cannot create assets
     */
    public AssetCreator assetCreator() {
        return assetCreator;
    }

    public String elementTypeKey() {
        return elementTypeKey;
    }

    public String classesKey() {
        return classesKey;
    }

    public long loopLimit() {
        return loopLimit;
    }

    public static final class Builder {
        private final Set<String> activeMods = new LinkedHashSet<>();
        private RulesetRegistry rulesets = RulesetRegistry.empty();
        private final Map<String, PatchFunction> functions = new LinkedHashMap<>(Builtins.all());
        private final Map<String, MixinDefinition> mixins = new LinkedHashMap<>();
        private final Map<String, Patch> libraries = new LinkedHashMap<>();
        private AssetCreator assetCreator;
        private String elementTypeKey = DEFAULT_ELEMENT_TYPE_KEY;
        private String classesKey = DEFAULT_CLASSES_KEY;
        private long loopLimit = DEFAULT_LOOP_LIMIT;

        private Builder() {
        }

        public Builder activeMod(String mod) {
            activeMods.add(mod);
            return this;
        }

        public Builder activeMods(Collection<String> mods) {
            activeMods.addAll(mods);
            return this;
        }

        public Builder rulesets(RulesetRegistry rulesets) {
            this.rulesets = rulesets;
            return this;
        }

        /**
         * Registers a host function; a builtin of the same name is replaced.
         */
        public Builder function(String name, PatchFunction function) {
            if (name == null || name.isBlank() || function == null) {
                throw new IllegalArgumentException("Functions need a name and an implementation");
            }
            functions.put(name, function);
            return this;
        }

        public Builder mixin(MixinDefinition mixin) {
            mixins.put(mixin.name(), mixin);
            return this;
        }

        public Builder library(String name, Patch library) {
            libraries.put(name, library);
            return this;
        }

        public Builder assetCreator(AssetCreator assetCreator) {
            this.assetCreator = assetCreator;
            return this;
        }

        public Builder elementTypeKey(String elementTypeKey) {
            this.elementTypeKey = elementTypeKey;
            return this;
        }

        public Builder classesKey(String classesKey) {
            this.classesKey = classesKey;
            return this;
        }

        public Builder loopLimit(long loopLimit) {
            if (loopLimit <= 0) {
                throw new IllegalArgumentException("Loop limit must be positive");
            }
            this.loopLimit = loopLimit;
            return this;
        }

        public PatchEnvironment build() {
            return new PatchEnvironment(this);
        }
    }
}
