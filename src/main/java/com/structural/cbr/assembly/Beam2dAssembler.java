package com.structural.cbr.assembly;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import org.ejml.data.DMatrixRMaj;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.ops.DConvertMatrixStruct;
import org.ejml.sparse.csc.CommonOps_DSCC;

import com.structural.cbr.api.DofComponent;
import com.structural.cbr.api.DofKey;
import com.structural.cbr.api.DofSet;
import com.structural.cbr.model.Element;
import com.structural.cbr.model.ElementType;
import com.structural.cbr.model.FeModel;
import com.structural.cbr.model.Material;
import com.structural.cbr.model.ModelValidationException;
import com.structural.cbr.model.Node;
import com.structural.cbr.model.Section;

import lombok.extern.log4j.Log4j2;

/**
 * Assembles in-plane (XY) frame elements.
 *
 * <p>
 * DOF layout: the end nodes (slots 1 and 2) of all elements in ascending node
 * ID, each carrying Ux, Uy and Rz. Slot 3 is an orientation reference and gets
 * no DOFs. Out-of-plane components are never created.
 *
 * <p>
 * Element matrices:
 * <ul>
 * <li>Stiffness: axial {@code EA/L} plus bending {@code EIzz/L³} with the
 * Timoshenko shear parameter {@code φ = 12 E Izz / (G ky A L²)}; an infinite
 * or zero {@code ky} gives Euler-Bernoulli behaviour ({@code φ = 0}).</li>
 * <li>Mass: consistent, {@code ρAL/6} axial and {@code ρAL/420} bending.</li>
 * </ul>
 * Both are rotated to global axes with the element direction cosines, then
 * scattered as sparse triplets and converted once to dense form.
 */
@Log4j2
public final class Beam2dAssembler implements FeAssembler {
    private static final int ELEMENT_DOFS = 6;
    private static final DofComponent[] NODE_COMPONENTS = { DofComponent.UX, DofComponent.UY, DofComponent.RZ };

    @Override
    public AssembledSystem assemble(FeModel model) {
        DofSet dofs = dofLayout(model);
        int n = dofs.size();
        int nnz = model.elements().size() * ELEMENT_DOFS * ELEMENT_DOFS;
        DMatrixSparseTriplet kTriplets = new DMatrixSparseTriplet(n, n, nnz);
        DMatrixSparseTriplet mTriplets = new DMatrixSparseTriplet(n, n, nnz);

        for (Element e : model.elements()) {
            ElementType type = model.type(e.typeId());
            if (type == null || !type.isBeam())
                throw new ModelValidationException("Element " + e.id() + ": unsupported element type "
                        + (type == null ? e.typeId() : type.name()) + ", only beam elements are supported");
            Node a = requireNode(model, e, 0);
            Node b = requireNode(model, e, 1);
            Section section = model.section(e.sectionId());
            Material material = model.material(e.materialId());

            double dx = b.x() - a.x();
            double dy = b.y() - a.y();
            double length = Math.hypot(dx, dy);
            if (!(length > 0))
                throw new ModelValidationException("Element " + e.id() + " has zero length in the XY plane");

            DMatrixRMaj rotation = rotation(dx / length, dy / length);
            DMatrixRMaj k = toGlobal(localStiffness(section, material, length), rotation);
            DMatrixRMaj m = toGlobal(localMass(section, material, length), rotation);

            int[] map = new int[ELEMENT_DOFS];
            for (int c = 0; c < 3; c++) {
                map[c] = dofs.indexOf(a.id(), NODE_COMPONENTS[c]);
                map[3 + c] = dofs.indexOf(b.id(), NODE_COMPONENTS[c]);
            }
            for (int i = 0; i < ELEMENT_DOFS; i++) {
                for (int j = 0; j < ELEMENT_DOFS; j++) {
                    kTriplets.addItem(map[i], map[j], k.get(i, j));
                    mTriplets.addItem(map[i], map[j], m.get(i, j));
                }
            }
        }

        DMatrixRMaj stiffness = toDense(kTriplets);
        DMatrixRMaj mass = toDense(mTriplets);
        AssembledSystem system = new AssembledSystem(dofs, stiffness, mass);
        log.info("Assembled {} beam elements: {}x{} matrices, K asymmetry {}, M asymmetry {}",
                model.elements().size(), n, n, system.stiffnessAsymmetry(), system.massAsymmetry());
        return system;
    }

    /** Ux, Uy, Rz of every element end node, ascending by node ID. */
    public static DofSet dofLayout(FeModel model) {
        TreeSet<Integer> endNodes = new TreeSet<>();
        for (Element e : model.elements()) {
            for (int slot = 0; slot < 2; slot++)
                if (e.nodeId(slot) != 0)
                    endNodes.add(e.nodeId(slot));
        }
        List<DofKey> keys = new ArrayList<>(endNodes.size() * NODE_COMPONENTS.length);
        for (int node : endNodes)
            for (DofComponent c : NODE_COMPONENTS)
                keys.add(DofKey.of(node, c));
        return DofSet.of(keys);
    }

    private static Node requireNode(FeModel model, Element e, int slot) {
        int id = e.nodeId(slot);
        Node node = id == 0 ? null : model.node(id);
        if (node == null)
            throw new ModelValidationException("Element " + e.id() + ": end node slot " + (slot + 1)
                    + " does not reference a defined node");
        return node;
    }

    static DMatrixRMaj localStiffness(Section s, Material mat, double length) {
        double e = mat.youngsModulus();
        double ei = e * s.izz();
        double phi = shearParameter(s, mat, length);
        double axial = e * s.area() / length;
        double b = ei / ((1 + phi) * length * length * length);
        double l = length;
        double l2 = length * length;

        DMatrixRMaj k = new DMatrixRMaj(ELEMENT_DOFS, ELEMENT_DOFS);
        setSym(k, 0, 0, axial);
        setSym(k, 0, 3, -axial);
        setSym(k, 3, 3, axial);

        setSym(k, 1, 1, 12 * b);
        setSym(k, 1, 2, 6 * l * b);
        setSym(k, 1, 4, -12 * b);
        setSym(k, 1, 5, 6 * l * b);
        setSym(k, 2, 2, (4 + phi) * l2 * b);
        setSym(k, 2, 4, -6 * l * b);
        setSym(k, 2, 5, (2 - phi) * l2 * b);
        setSym(k, 4, 4, 12 * b);
        setSym(k, 4, 5, -6 * l * b);
        setSym(k, 5, 5, (4 + phi) * l2 * b);
        return k;
    }

    static DMatrixRMaj localMass(Section s, Material mat, double length) {
        double total = mat.density() * s.area() * length;
        double a = total / 6;
        double q = total / 420;
        double l = length;
        double l2 = length * length;

        DMatrixRMaj m = new DMatrixRMaj(ELEMENT_DOFS, ELEMENT_DOFS);
        setSym(m, 0, 0, 2 * a);
        setSym(m, 0, 3, a);
        setSym(m, 3, 3, 2 * a);

        setSym(m, 1, 1, 156 * q);
        setSym(m, 1, 2, 22 * l * q);
        setSym(m, 1, 4, 54 * q);
        setSym(m, 1, 5, -13 * l * q);
        setSym(m, 2, 2, 4 * l2 * q);
        setSym(m, 2, 4, 13 * l * q);
        setSym(m, 2, 5, -3 * l2 * q);
        setSym(m, 4, 4, 156 * q);
        setSym(m, 4, 5, -22 * l * q);
        setSym(m, 5, 5, 4 * l2 * q);
        return m;
    }

    static double shearParameter(Section s, Material mat, double length) {
        double ky = s.ky();
        if (Double.isInfinite(ky) || ky <= 0 || s.izz() == 0)
            return 0;
        return 12 * mat.youngsModulus() * s.izz() / (mat.shearModulus() * ky * s.area() * length * length);
    }

    /** Local-to-global rotation for one element; both nodes share the 3x3 block. */
    static DMatrixRMaj rotation(double c, double s) {
        DMatrixRMaj r = new DMatrixRMaj(ELEMENT_DOFS, ELEMENT_DOFS);
        for (int base = 0; base < ELEMENT_DOFS; base += 3) {
            r.set(base, base, c);
            r.set(base, base + 1, s);
            r.set(base + 1, base, -s);
            r.set(base + 1, base + 1, c);
            r.set(base + 2, base + 2, 1);
        }
        return r;
    }

    private static DMatrixRMaj toGlobal(DMatrixRMaj local, DMatrixRMaj r) {
        DMatrixRMaj tmp = new DMatrixRMaj(ELEMENT_DOFS, ELEMENT_DOFS);
        CommonOps_DDRM.multTransA(r, local, tmp);
        DMatrixRMaj out = new DMatrixRMaj(ELEMENT_DOFS, ELEMENT_DOFS);
        CommonOps_DDRM.mult(tmp, r, out);
        return out;
    }

    private static DMatrixRMaj toDense(DMatrixSparseTriplet triplets) {
        DMatrixSparseCSC csc = DConvertMatrixStruct.convert(triplets, (DMatrixSparseCSC) null);
        csc.sortIndices(null);
        CommonOps_DSCC.duplicatesAdd(csc, null);
        return DConvertMatrixStruct.convert(csc, (DMatrixRMaj) null);
    }

    private static void setSym(DMatrixRMaj m, int i, int j, double v) {
        m.set(i, j, v);
        m.set(j, i, v);
    }
}
