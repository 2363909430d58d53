package com.flagship.job_ledger.costing;

public enum CostType {
    LABOUR,
    MATERIAL,
    SUBCONTRACTOR,
    PLANT,
    OTHER
}
