package com.platform.resilience.estimator;

import java.util.List;

/**
 * Success rule of an endpoint over its target services.
 * 
 * Each rule decides from three counts: targets considered, how many of those are reachable,
 * and how many targets were set aside as not structurally required.
 */
public sealed interface SuccessRule permits SuccessRule.AnyOf, SuccessRule.AllOf, SuccessRule.KOfN {
    
    List<String> items();
    
    boolean isSatisfied(int reachable, int considered, int setAside);
    
    /**
     * At least one target reachable. No considered targets means success.
     */
    record AnyOf(List<String> items) implements SuccessRule {
        public AnyOf {
            items = List.copyOf(items);
        }
        
        @Override
        public boolean isSatisfied(int reachable, int considered, int setAside) {
            return considered == 0 || reachable > 0;
        }
    }
    
    /**
     * Every target reachable. No considered targets means success.
     */
    record AllOf(List<String> items) implements SuccessRule {
        public AllOf {
            items = List.copyOf(items);
        }
        
        @Override
        public boolean isSatisfied(int reachable, int considered, int setAside) {
            return considered == 0 || reachable == considered;
        }
    }
    
    /**
     * At least k targets reachable. Each target set aside lowers k by one.
     */
    record KOfN(int k, List<String> items) implements SuccessRule {
        public KOfN {
            items = List.copyOf(items);
        }
        
        @Override
        public boolean isSatisfied(int reachable, int considered, int setAside) {
            int required = Math.max(0, k - setAside);
            if (required == 0) {
                return true;
            }
            if (considered == 0) {
                return false;
            }
            return reachable >= Math.min(required, considered);
        }
    }
}
