package at.sv.salat.hijri;

import at.sv.salat.InvalidPropertyValue;

public enum HijriMonth {
    MUHARRAM("Muharram"),
    SAFAR("Safar"),
    RABI_AL_AWWAL("Rabi al-Awwal"),
    RABI_AL_THANI("Rabi al-Thani"),
    JUMADA_AL_ULA("Jumada al-Ula"),
    JUMADA_AL_AKHIRAH("Jumada al-Akhirah"),
    RAJAB("Rajab"),
    SHABAN("Sha'ban"),
    RAMADAN("Ramadan"),
    SHAWWAL("Shawwal"),
    DHU_AL_QADAH("Dhu al-Qa'dah"),
    DHU_AL_HIJJAH("Dhu al-Hijjah");

    private final String displayName;

    HijriMonth(String displayName) {
        this.displayName = displayName;
    }

    public static HijriMonth of(int month) {
        if (month < 1 || month > 12) {
            throw new InvalidPropertyValue("Invalid Hijri month '" + month + "'. Supported values: [1..12]");
        }
        return values()[month - 1];
    }

    public int getValue() {
        return ordinal() + 1;
    }

    public String getDisplayName() {
        return displayName;
    }
}
