/*******************************************************************************
 * HSSPcore - Homology-derived Secondary Structure of Proteins
 * Copyright 2016 Jorge Duitama
 *
 * This file is part of HSSPcore.
 *
 *     HSSPcore is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     HSSPcore is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with HSSPcore.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package hssp.databank;

/**
 * Databank used to retrieve the metadata of the sequences found as hits
 */
public interface SequenceDatabank {
	/**
	 * @return String version of the databank
	 */
	public String getVersion();

	/**
	 * Retrieves the metadata of the sequence with the given id
	 * @param id Id of the sequence
	 * @return DatabankEntry metadata or null if the id is not found
	 */
	public DatabankEntry lookup(String id);
}
