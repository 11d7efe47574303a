package de.bsommerfeld.northwind.core.domain;

import java.time.LocalDate;

/**
 * Immutable row of the Northwind {@code Employees} table.
 * Only {@code firstName} and {@code lastName} are mandatory; every other
 * attribute is {@code null} when the store holds no value for it.
 *
 * @param id              store-assigned key, {@code 0} until the record has
 *                        been inserted
 * @param firstName       given name
 * @param lastName        family name
 * @param title           job title, e.g. {@code Sales Representative}
 * @param titleOfCourtesy salutation, e.g. {@code Ms.}
 * @param birthDate       date of birth
 * @param hireDate        first day of employment
 * @param address         street address
 * @param city            city
 * @param region          region or state
 * @param postalCode      postal code
 * @param country         country
 * @param homePhone       home phone number
 * @param extension       internal phone extension
 * @param notes           free-form notes
 * @param reportsTo       {@code EmployeeID} of the manager, not checked against
 *                        existing rows
 * @param photoPath       URL or path of the employee photo
 */
public record Employee(
        long id,
        String firstName,
        String lastName,
        String title,
        String titleOfCourtesy,
        LocalDate birthDate,
        LocalDate hireDate,
        String address,
        String city,
        String region,
        String postalCode,
        String country,
        String homePhone,
        String extension,
        String notes,
        Integer reportsTo,
        String photoPath) {

    /** Marker value of {@link #id()} for records the store has not seen yet. */
    public static final long UNASSIGNED_ID = 0L;

    /**
     * Summary projection as returned by the employee listing.
     */
    public Employee(long id, String firstName, String lastName, String title) {
        this(id, firstName, lastName, title, null, null, null, null, null, null,
                null, null, null, null, null, null, null);
    }

    /**
     * New employee that has not been inserted yet.
     */
    public Employee(String firstName, String lastName, String title) {
        this(UNASSIGNED_ID, firstName, lastName, title);
    }

    /** Returns {@code true} once the store has assigned an id. */
    public boolean hasId() {
        return id != UNASSIGNED_ID;
    }

    /**
     * Returns a copy of this employee carrying the given id. Used to attach
     * the key generated on insert; the original record stays untouched.
     */
    public Employee withId(long newId) {
        return new Employee(newId, firstName, lastName, title, titleOfCourtesy,
                birthDate, hireDate, address, city, region, postalCode, country,
                homePhone, extension, notes, reportsTo, photoPath);
    }
}
