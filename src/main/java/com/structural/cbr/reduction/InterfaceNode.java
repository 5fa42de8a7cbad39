package com.structural.cbr.reduction;

/**
 * An interface node as seen by the downstream consumer.
 *
 * @param dofCount How many of its Ux, Uy, Rz DOFs became masters (0..3).
 */
public record InterfaceNode(int nodeId, double x, double y, double z, int dofCount) {
}
