package sdline.it.validation.table;

import sdline.it.model.SampleMask;

/**
 * Per-sample MASKLIST / NOCHANGE store read and written by the line validator.
 */
public interface MaskTable {

    /**
     * @return the stored record, or an empty mask marked changed when the row has none
     */
    SampleMask get(int row);

    void put(int row, SampleMask mask);
}
