package com.structural.cbr.assembly;

import com.structural.cbr.model.FeModel;

/**
 * Builds the global stiffness and mass matrices of a model together with the
 * DOF ordering of their rows and columns.
 */
public interface FeAssembler {

    AssembledSystem assemble(FeModel model);
}
